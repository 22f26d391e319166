package com.temenos;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

@SpringBootTest
@ActiveProfiles("test")
class TemenosApplicationTests {

	@DynamicPropertySource
	static void dataDir(DynamicPropertyRegistry registry) {
		TestDataDirectory.register(registry);
	}

	@Test
	void contextLoads() {
	}

}
