package com.example.demo.sheets;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SheetHappensApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(SheetHappensApplication.class, args)));
	}

}
