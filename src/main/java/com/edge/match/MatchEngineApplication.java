package com.edge.match;

import com.edge.match.config.NativeLibraryLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MatchEngineApplication {

    public static void main(String[] args) {
        // OpenCV 必须在任何 Mat 操作之前加载
        NativeLibraryLoader.loadNativeLibraries();
        SpringApplication.run(MatchEngineApplication.class, args);
    }
}
