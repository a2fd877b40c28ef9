package com.bookdrop.catalogagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CatalogAgentApplication {

	public static void main(String[] args) {
		SpringApplication.run(CatalogAgentApplication.class, args);
	}

}
