package com.mouse.crawl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ResilientCrawlerApplication {

	public static void main(String[] args) {
		SpringApplication.run(ResilientCrawlerApplication.class, args);
	}

}
