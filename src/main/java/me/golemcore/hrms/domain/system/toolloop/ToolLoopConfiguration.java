package me.golemcore.hrms.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.hrms.domain.service.HrToolDispatcher;
import me.golemcore.hrms.domain.tool.HrToolCatalog;
import me.golemcore.hrms.infrastructure.config.HrmsProperties;
import me.golemcore.hrms.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ToolLoopConfiguration {

    @Bean
    public ToolExecutorPort toolExecutorPort(HrToolDispatcher dispatcher, ObjectMapper objectMapper) {
        return new DispatcherToolExecutorAdapter(dispatcher, objectMapper);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutorPort,
            HrToolCatalog toolCatalog, HrmsProperties properties, Clock clock) {
        return new DefaultToolLoopSystem(llmPort, toolExecutorPort, toolCatalog, properties, clock);
    }
}
