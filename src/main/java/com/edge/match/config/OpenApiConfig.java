package com.edge.match.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI matchEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Match Event Engine API")
                        .description("""
                                足球比赛跟踪与事件推断引擎 API

                                ## 功能概述

                                ### 核心功能
                                - **比赛分析**：检测过滤、跟踪、队伍分类、控球段与传球/带球/球权转换推断
                                - **事件去重**：合并重叠分析窗口产出的事件，确定位置并做一致性校验
                                - **单应性**：由场地关键点估计屏幕到场地的投影矩阵，并转换坐标
                                - **帧检测**：调用配置的检测器并采样球衣颜色

                                ### 检测器策略
                                | 策略 | 说明 |
                                |------|------|
                                | `placeholder` | 不依赖模型，返回空结果 |
                                | `remote` | 调用外部推理服务 |

                                ### API 响应格式
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                """)
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }

    /**
     * 为所有接口添加统一的响应格式
     */
    @Bean
    public OpenApiCustomizer globalResponseCustomizer() {
        return openApi -> openApi.getPaths().forEach((path, pathItem) -> {
            if (pathItem.getGet() != null) {
                pathItem.getGet().getResponses().addApiResponse("200", envelope("成功", "success"));
            }
            if (pathItem.getPost() != null) {
                pathItem.getPost().getResponses().addApiResponse("200", envelope("成功", "success"));
                pathItem.getPost().getResponses().addApiResponse("400", envelope("请求错误", "error"));
            }
        });
    }

    private ApiResponse envelope(String description, String status) {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态: success/error").example(status),
                "data", new Schema<>().type("object").description("响应数据"),
                "message", new Schema<>().type("string").description("消息（可选）")
        ));
        return new ApiResponse()
                .description(description)
                .content(new Content().addMediaType("application/json", new MediaType().schema(schema)));
    }
}
