package com.example.streampanel;

import com.example.streampanel.common.config.AppAuthProperties;
import com.example.streampanel.common.config.AppLicenseProperties;
import com.example.streampanel.common.config.AppStreamProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.example.streampanel.infrastructure.persistence.mapper")
@EnableScheduling
@EnableConfigurationProperties({
        AppAuthProperties.class,
        AppStreamProperties.class,
        AppLicenseProperties.class
})
public class StreamPanelApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamPanelApplication.class, args);
    }
}
