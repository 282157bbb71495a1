package com.koni.product;

import com.koni.product.application.service.ProductEventService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
class ProductEventsApplicationTests {

	@MockBean
	private KafkaTemplate<String, String> kafkaTemplate;

	@Autowired
	private ProductEventService productEventService;

	@Test
	void contextLoads() {
		assertThat(productEventService).isNotNull();
	}

}
