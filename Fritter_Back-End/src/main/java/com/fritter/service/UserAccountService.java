package com.fritter.service;

import com.fritter.repo.domain.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class UserAccountService {

    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);

    @Autowired
    private UserCollection userCollection;

    @Autowired
    private FriendshipCollection friendshipCollection;

    /**
     * Remove a user account and every friendship it is part of.
     * The username is resolved once; friendships go first, then the user. Not transactional.
     *
     * @return true if the user document was deleted
     */
    public boolean deleteAccount(String username) {
        User user = userCollection.findOneByUsername(username);
        friendshipCollection.deleteAllFriendshipOfUser(user);
        boolean deleted = userCollection.deleteOne(user.getId());
        log.debug("Account {} removed: {}", username, deleted);
        return deleted;
    }
}
