package com.prediction.market.options_market.config;

import java.util.List;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

import com.prediction.market.options_market.entity.Money;

/**
 * Money is stored as its plain decimal string so no precision is lost.
 */
@Configuration
@EnableMongoRepositories(basePackages = "com.prediction.market.options_market.repositories")
public class MongoConfig {

    @Bean
    MongoCustomConversions mongoCustomConversions() {
        return new MongoCustomConversions(List.of(new MoneyToStringConverter(), new StringToMoneyConverter()));
    }

    @WritingConverter
    static class MoneyToStringConverter implements Converter<Money, String> {
        @Override
        public String convert(Money source) {
            return source.toString();
        }
    }

    @ReadingConverter
    static class StringToMoneyConverter implements Converter<String, Money> {
        @Override
        public Money convert(String source) {
            return Money.of(source);
        }
    }
}
