package com.framecap.framecap.config;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingInterceptor.class);
    private static final String START_ATTRIBUTE = RequestLoggingInterceptor.class.getName() + ".start";

    @Value("${logging.request.enabled:false}")
    private boolean enabled;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!enabled) {
            return true;
        }

        long ts = System.currentTimeMillis();
        request.setAttribute(START_ATTRIBUTE, ts);
        String iso = ZonedDateTime.ofInstant(Instant.ofEpochMilli(ts), ZoneId.systemDefault())
                .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        String handlerInfo = (handler instanceof HandlerMethod) ? ((HandlerMethod) handler).getShortLogMessage() : String.valueOf(handler);

        logger.info("Incoming request - time={}, method={}, uri={}, handler={}, remoteAddr={}",
                iso, request.getMethod(), request.getRequestURI(), handlerInfo, request.getRemoteAddr());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        Object start = request.getAttribute(START_ATTRIBUTE);
        if (!enabled || !(start instanceof Long)) {
            return;
        }
        logger.info("Completed request - method={}, uri={}, status={}, took={}ms",
                request.getMethod(), request.getRequestURI(), response.getStatus(),
                System.currentTimeMillis() - (Long) start);
    }
}
