package com.example.storelab.config;

import com.example.storelab.models.UserStatus;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

/**
 * Stores {@link UserStatus} under its lower-case value instead of the constant name, so documents
 * read the same as the JSON the API returns.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions mongoCustomConversions() {
        return new MongoCustomConversions(List.of(
                new UserStatusWritingConverter(),
                new UserStatusReadingConverter()));
    }

    @WritingConverter
    static class UserStatusWritingConverter implements Converter<UserStatus, String> {
        @Override
        public String convert(UserStatus source) {
            return source.value();
        }
    }

    @ReadingConverter
    static class UserStatusReadingConverter implements Converter<String, UserStatus> {
        @Override
        public UserStatus convert(String source) {
            return UserStatus.fromValue(source)
                    .orElseThrow(() -> new IllegalStateException("Unknown stored user status " + source));
        }
    }
}
