package com.uniclass;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Uniclass 检索网关 - 启动类。
 */
@SpringBootApplication(scanBasePackages = "com.uniclass")
public class UniclassApplication {

    public static void main(String[] args) throws Exception {
        // SQLite 不会自动创建父目录，启动前确保 data/ 存在
        Files.createDirectories(Path.of("data"));
        SpringApplication.run(UniclassApplication.class, args);
    }
}
