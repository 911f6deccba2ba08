package com.sceneanchor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SceneAnchor - stable scene references across manuscript edits.
 */
@SpringBootApplication
public class SceneAnchorApplication {

	public static void main(String[] args) {
		SpringApplication.run(SceneAnchorApplication.class, args);
	}

}
