package com.github.dimitryivaniuta.agentgateway.web;

import com.github.dimitryivaniuta.agentgateway.health.HealthMonitor;
import com.github.dimitryivaniuta.agentgateway.ratelimit.RateLimitAdminController;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "agent-gateway.rate-limit.admin.token=configured-but-disabled")
@AutoConfigureMockMvc
class RateLimitAdminDisabledTest {

    @Autowired MockMvc mvc;
    @Autowired ApplicationContext context;

    @MockBean HealthMonitor healthMonitor;

    @Test
    void adminEndpointsAreNotRegisteredByDefault() throws Exception {
        assertThat(context.getBeanNamesForType(RateLimitAdminController.class)).isEmpty();

        mvc.perform(get("/rate-limit/stats").header(RateLimitAdminController.ADMIN_TOKEN_HEADER, "configured-but-disabled"))
                .andExpect(status().isNotFound());
    }
}
