package com.example.docsync;

import com.example.docsync.config.DocSyncProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(DocSyncProperties.class)
public class DocSyncApplication {

	public static void main(String[] args) {
		SpringApplication.run(DocSyncApplication.class, args);
	}

}
