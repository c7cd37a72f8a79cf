package com.example.litestream.controller;

import com.example.litestream.config.DataSourceFactory;
import com.example.litestream.config.DatabaseRegistry;
import com.example.litestream.config.DatabaseSettings;
import com.example.litestream.config.GlobalExceptionHandler;
import com.example.litestream.config.LitestreamConfigGenerator;
import com.example.litestream.config.LitestreamProperties;
import com.example.litestream.config.ReplicaConfigurationException;
import com.example.litestream.config.ReplicaEndpoint;
import com.example.litestream.replica.ReplicaStatus;
import com.example.litestream.replica.ReplicaStatusProber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DatabaseMonitoringControllerTest {

    private ReplicaStatusProber prober;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        DatabaseRegistry registry = new DatabaseRegistry(mock(DataSourceFactory.class));
        registry.register(DatabaseSettings.primary("default", "db.sqlite3"));
        registry.register(DatabaseSettings.replica(new ReplicaEndpoint("r1", "s3://a/db", 60)));
        registry.register(DatabaseSettings.replica(new ReplicaEndpoint("r2", "s3://b/db", 60)));
        prober = mock(ReplicaStatusProber.class);

        DatabaseMonitoringController controller = new DatabaseMonitoringController(registry, prober,
            new LitestreamConfigGenerator(new LitestreamProperties()));
        mvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void reportsSingleReplicaStatus() throws Exception {
        when(prober.probe("r1")).thenReturn(new ReplicaStatus("r1", "s3://a/db", "42", 10.0, Instant.EPOCH));

        mvc.perform(get("/api/db/replicas/r1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.alias").value("r1"))
            .andExpect(jsonPath("$.is_replica").value(true))
            .andExpect(jsonPath("$.source_url").value("s3://a/db"))
            .andExpect(jsonPath("$.txid").value("42"))
            .andExpect(jsonPath("$.lag_seconds").value(10.0));
    }

    @Test
    void unknownLagIsNull() throws Exception {
        when(prober.probe("r1")).thenReturn(new ReplicaStatus("r1", "s3://a/db", "42", null, Instant.EPOCH));

        mvc.perform(get("/api/db/replicas/r1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.lag_seconds").value(nullValue()));
    }

    @Test
    void listsReplicasWithHealth() throws Exception {
        when(prober.probe("r1")).thenReturn(new ReplicaStatus("r1", "s3://a/db", "1", 10.0, Instant.EPOCH));
        when(prober.probe("r2")).thenReturn(new ReplicaStatus("r2", "s3://b/db", "1", 400.0, Instant.EPOCH));

        mvc.perform(get("/api/db/replicas"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].status.alias").value("r1"))
            .andExpect(jsonPath("$[0].healthy").value(true))
            .andExpect(jsonPath("$[1].status.alias").value("r2"))
            .andExpect(jsonPath("$[1].healthy").value(false))
            .andExpect(jsonPath("$[1].max_lag_seconds").value(60.0));
    }

    @Test
    void configurationErrorsMapToClientErrors() throws Exception {
        when(prober.probe("nope")).thenThrow(ReplicaConfigurationException.notFound("nope"));
        when(prober.probe("default")).thenThrow(ReplicaConfigurationException.notReplica("default"));

        mvc.perform(get("/api/db/replicas/nope"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value(containsString("nope")));
        mvc.perform(get("/api/db/replicas/default"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void rendersLitestreamConfig() throws Exception {
        mvc.perform(get("/api/db/litestream-config"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("$LITESTREAM_REPLICA_BUCKET")))
            .andExpect(content().string(containsString("db.sqlite3")));
    }
}
