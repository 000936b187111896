package com.wangbin.hvac;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
@Slf4j
public class HvacEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(HvacEngineApplication.class, args);
        log.info("HVAC 控制引擎启动完成");
    }
}
