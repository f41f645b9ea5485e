package com.typerace.partyservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * party-service 启动入口。
 * 通过 @ConfigurationPropertiesScan 统一装配 typing.* 等业务配置。
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PartyServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PartyServiceApplication.class, args);
    }
}
