package com.fritter.service;

import com.fritter.exception.UserNotFoundException;
import com.fritter.repo.UserRepository;
import com.fritter.repo.domain.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Date;
import java.util.Optional;

/**
 * Minimal user accessor: what the friendship layer needs to resolve usernames,
 * plus creation and removal of user documents.
 */
@Service
public class UserCollection {

    private static final Logger log = LoggerFactory.getLogger(UserCollection.class);

    @Autowired
    private UserRepository userRepository;

    public User addOne(String username, String password) {
        User user = new User(username, password, new Date());
        User saved = userRepository.save(user);
        log.debug("User created: {} ({})", saved.getUsername(), saved.getId());
        return saved;
    }

    public Optional<User> findOneByUserId(String userId) {
        return userRepository.findById(userId);
    }

    /**
     * @throws UserNotFoundException if no user has this username
     */
    public User findOneByUsername(String username) {
        return userRepository.findByUsername(username)
                .orElseThrow(() -> new UserNotFoundException(username));
    }

    /**
     * @return true if a user document was deleted
     */
    public boolean deleteOne(String userId) {
        long deleted = userRepository.removeById(userId);
        log.debug("User {} delete: {} document(s) removed", userId, deleted);
        return deleted > 0;
    }
}
