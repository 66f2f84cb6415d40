package com.jdc.foodgram;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FoodgramApplication {

	public static void main(String[] args) {
		SpringApplication.run(FoodgramApplication.class, args);
	}

}
