package com.example.catalog_import;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class CatalogImportApplication {

	public static void main(String[] args) {
		SpringApplication.run(CatalogImportApplication.class, args);
	}

}
