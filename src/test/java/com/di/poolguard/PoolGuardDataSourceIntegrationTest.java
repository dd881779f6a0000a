package com.di.poolguard;

import com.di.poolguard.executor.QueryExecutor;
import com.di.poolguard.manager.ConnectionPoolManager;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
		"poolguard.datasource.jdbc-url=jdbc:h2:mem:poolguard-it;DB_CLOSE_DELAY=-1",
		"poolguard.datasource.username=sa",
		"poolguard.datasource.password=",
		"poolguard.overrides.max-connections=4"
})
@AutoConfigureMockMvc
@DirtiesContext
@DisplayName("PoolGuard DataSource Integration Tests")
class PoolGuardDataSourceIntegrationTest {

	@Autowired
	private ConnectionPoolManager manager;

	@Autowired
	private HikariDataSource dataSource;

	@Autowired
	private QueryExecutor queryExecutor;

	@Autowired
	private MockMvc mockMvc;

	@Test
	@DisplayName("Should size the Hikari pool from the active pool config")
	void testPoolSizedFromConfig() {
		assertEquals(manager.getConfig().getMaxConnections(), dataSource.getMaximumPoolSize());
		assertEquals("hikari", manager.getTelemetrySource());
		assertNotNull(queryExecutor);
	}

	@Test
	@DisplayName("Should run the validation query through the probe endpoint")
	void testProbe() throws Exception {
		mockMvc.perform(post("/api/pool/probe"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.rows").value(1))
				.andExpect(jsonPath("$.circuitBreakerState").value("closed"));
	}

	@Test
	@DisplayName("Should resize the pool on a profile switch")
	void testProfileSwitch() throws Exception {
		mockMvc.perform(post("/api/pool/admin/profile/production"))
				.andExpect(status().isOk());
		assertEquals(20, dataSource.getMaximumPoolSize());

		mockMvc.perform(post("/api/pool/admin/profile/development"))
				.andExpect(status().isOk());
		assertEquals(5, dataSource.getMaximumPoolSize());
	}
}
