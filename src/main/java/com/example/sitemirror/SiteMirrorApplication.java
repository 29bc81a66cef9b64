package com.example.sitemirror;

import com.example.sitemirror.config.MirrorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MirrorProperties.class)
public class SiteMirrorApplication {

	public static void main(String[] args) {
		SpringApplication.run(SiteMirrorApplication.class, args);
	}
}
