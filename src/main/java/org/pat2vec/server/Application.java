package org.pat2vec.server;

import org.pat2vec.server.config.Config;
import org.springframework.boot.SpringApplication;

public class Application extends Config {

	public static void main(String[] args) {
		SpringApplication.run(Application.class, args);
	}

}
