package com.fritter.converter;

import com.fritter.repo.domain.User;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * Converts a user id into a reference-only User (only the id is filled).
 * Enough for writing a @DBRef without loading the referenced document.
 */
@Component
public class StringToUserConverter implements Converter<String, User> {

    @Override
    public User convert(String source) {
        if (source == null || source.trim().isEmpty()) {
            return null;
        }

        User user = new User();
        user.setId(source.trim());
        return user;
    }
}
