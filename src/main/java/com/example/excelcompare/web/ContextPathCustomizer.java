package com.example.excelcompare.web;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.boot.web.servlet.server.ConfigurableServletWebServerFactory;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ContextPathCustomizer implements WebServerFactoryCustomizer<ConfigurableServletWebServerFactory> {

    private final String contextPath;

    public ContextPathCustomizer(@Value("${excel.compare.prefix:}") String prefix) {
        this.contextPath = normalizePrefix(prefix);
    }

    @Override
    public void customize(ConfigurableServletWebServerFactory factory) {
        factory.setContextPath(contextPath);
        if (!contextPath.isEmpty()) {
            log.info("URL前缀: {}", contextPath);
        }
    }

    public String contextPath() {
        return contextPath;
    }

    static String normalizePrefix(String raw) {
        if (raw == null) {
            return "";
        }
        String s = raw.trim();
        while (s.startsWith("/")) {
            s = s.substring(1);
        }
        while (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        return s.isEmpty() ? "" : "/" + s;
    }
}
