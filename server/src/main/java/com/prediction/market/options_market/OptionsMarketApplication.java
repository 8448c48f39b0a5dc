package com.prediction.market.options_market;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.prediction.market.options_market.config.MarketProperties;

@SpringBootApplication
@EnableConfigurationProperties(MarketProperties.class)
public class OptionsMarketApplication {

	public static void main(String[] args) {
		SpringApplication.run(OptionsMarketApplication.class, args);
	}

}
