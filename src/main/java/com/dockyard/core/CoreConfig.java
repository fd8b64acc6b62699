package com.dockyard.core;

import com.dockyard.core.ports.PortAllocator;
import com.dockyard.core.ports.PortStore;
import com.dockyard.core.ports.SocketPortProbe;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CoreConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PortAllocator portAllocator(PortStore portStore, Clock clock) {
        return new PortAllocator(portStore, new SocketPortProbe(), clock);
    }
}
