package org.geoloader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GeoImportMcpServerApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(GeoImportMcpServerApplication.class, args);
    }

    /**
     * 提前创建日志目录，RollingFileAppender 不会自己创建父目录。
     * <p>
     * 与 logback-spring.xml 一致：优先系统属性/环境变量 LOG_PATH，默认 ./logs
     */
    private static void ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        try {
            Files.createDirectories(Path.of(logPath));
        } catch (IOException e) {
            // stdout 属于 MCP stdio 通道，这里只能写 stderr
            System.err.println("无法创建日志目录 " + logPath + ": " + e.getMessage());
        }
    }
}
