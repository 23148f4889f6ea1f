package com.synapse.x;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SynapseXApplication {

	public static void main(String[] args) {
		SpringApplication.run(SynapseXApplication.class, args);
	}

}
