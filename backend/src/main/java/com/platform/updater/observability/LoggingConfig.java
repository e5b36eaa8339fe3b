package com.platform.updater.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: correlation IDs for API requests and MDC context for payload applies.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_PAYLOAD_SOURCE = "payloadSource";
    public static final String MDC_PAYLOAD_VERSION = "payloadVersion";
    public static final String MDC_MANIFEST = "manifest";
    
    @Value("${spring.application.name:cluster-updater}")
    private String applicationName;
    
    @PostConstruct
    public void init() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.putProperty("application", applicationName);
        }
        log.info("Logging configuration initialized for application: {}", applicationName);
    }
    
    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }
    
    public static class CorrelationIdFilter extends OncePerRequestFilter {
        
        static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        
        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            
            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }
                
                MDC.put(MDC_CORRELATION_ID, correlationId);
                response.setHeader(CORRELATION_ID_HEADER, correlationId);
                
                filterChain.doFilter(request, response);
                
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
            }
        }
    }
    
    /**
     * Set payload information in MDC for logging.
     */
    public static void setPayloadContext(String source, String version) {
        MDC.put(MDC_PAYLOAD_SOURCE, source);
        MDC.put(MDC_PAYLOAD_VERSION, version);
    }
    
    /**
     * Clear payload context from MDC.
     */
    public static void clearPayloadContext() {
        MDC.remove(MDC_PAYLOAD_SOURCE);
        MDC.remove(MDC_PAYLOAD_VERSION);
    }
    
    public static void setManifestContext(String manifest) {
        MDC.put(MDC_MANIFEST, manifest);
    }
    
    public static void clearManifestContext() {
        MDC.remove(MDC_MANIFEST);
    }
    
    /**
     * Correlation ID of the current request, or a fresh one outside a request.
     */
    public static String currentCorrelationId() {
        String correlationId = MDC.get(MDC_CORRELATION_ID);
        return correlationId != null ? correlationId : UUID.randomUUID().toString();
    }
}
