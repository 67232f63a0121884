package com.edge.match.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 记录 /api 请求的方法、路径、耗时和截断后的 JSON 报文
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    static final int MAX_REQUEST_BODY = 1000;
    static final int MAX_RESPONSE_BODY = 5000;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);

        long startTime = System.currentTimeMillis();
        logger.info(">>> {} {}", request.getMethod(), request.getRequestURI());

        try {
            filterChain.doFilter(requestWrapper, responseWrapper);
        } finally {
            long duration = System.currentTimeMillis() - startTime;

            if ("POST".equalsIgnoreCase(request.getMethod()) || "PUT".equalsIgnoreCase(request.getMethod())) {
                byte[] content = requestWrapper.getContentAsByteArray();
                if (content.length > 0 && logger.isDebugEnabled()) {
                    logger.debug("Request Body: {}", truncate(new String(content, StandardCharsets.UTF_8), MAX_REQUEST_BODY));
                }
            }

            byte[] responseContent = responseWrapper.getContentAsByteArray();
            String contentType = response.getContentType();
            if (responseContent.length > 0 && contentType != null && contentType.contains("json")
                    && logger.isDebugEnabled()) {
                logger.debug("Response Body: {}",
                        truncate(new String(responseContent, StandardCharsets.UTF_8), MAX_RESPONSE_BODY));
            }

            // 必须复制回原始响应，否则客户端收不到数据
            responseWrapper.copyBodyToResponse();

            logger.info("<<< {} {} | Status: {} | Duration: {} ms",
                    request.getMethod(), request.getRequestURI(), response.getStatus(), duration);
        }
    }

    static String truncate(String body, int max) {
        return body.length() > max ? body.substring(0, max) + "..." : body;
    }
}
