package com.fritter.service;

import com.fritter.converter.StringToUserConverter;
import com.fritter.repo.FriendshipRepository;
import com.fritter.repo.domain.Friendship;
import com.fritter.repo.domain.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * CRUD operations on friendships.
 * <p>
 * No uniqueness check is made on the pair of users: creating the same friendship twice
 * stores two documents. Callers confirm mutual consent before calling {@link #addOne}.
 */
@Service
public class FriendshipCollection {

    private static final Logger log = LoggerFactory.getLogger(FriendshipCollection.class);

    static final String SORT_FIELD = "dateCreated";

    @Autowired
    private FriendshipRepository friendshipRepository;

    @Autowired
    private UserCollection userCollection;

    @Autowired
    private StringToUserConverter userReferenceConverter;

    /**
     * Establish a friendship between two users.
     *
     * @return the new friendship, with both users loaded
     */
    public Friendship addOne(String userOneId, String userTwoId) {
        Friendship friendship = new Friendship(
                userReferenceConverter.convert(userOneId),
                userReferenceConverter.convert(userTwoId),
                new Date());
        Friendship saved = friendshipRepository.save(friendship);
        log.debug("Friendship created: {} <-> {} ({})", userOneId, userTwoId, saved.getId());

        // read back so the @DBRef users are resolved
        return friendshipRepository.findById(saved.getId()).orElse(saved);
    }

    public Optional<Friendship> findOne(String friendshipId) {
        return friendshipRepository.findById(friendshipId);
    }

    /**
     * All friendships, most recent first.
     */
    public List<Friendship> findAll() {
        return friendshipRepository.findAll(Sort.by(Sort.Direction.DESC, SORT_FIELD));
    }

    /**
     * All friendships where the user is either party (can be none).
     *
     * @throws com.fritter.exception.UserNotFoundException if the username does not resolve
     */
    public List<Friendship> findAllFriendshipsOfUser(String username) {
        User user = userCollection.findOneByUsername(username);
        List<Friendship> friendships = friendshipRepository.findAllInvolving(user.getId());
        log.debug("Found {} friendships for {}", friendships.size(), username);
        return friendships;
    }

    /**
     * @return true if the store deleted a friendship with this id
     */
    public boolean deleteOne(String friendshipId) {
        long deleted = friendshipRepository.removeById(friendshipId);
        log.debug("Friendship {} delete: {} document(s) removed", friendshipId, deleted);
        return deleted > 0;
    }

    /**
     * Delete every friendship the user is part of. Used when the user account is removed.
     *
     * @throws com.fritter.exception.UserNotFoundException if the username does not resolve
     */
    public void deleteAllFriendshipOfUser(String username) {
        deleteAllFriendshipOfUser(userCollection.findOneByUsername(username));
    }

    /**
     * Same as {@link #deleteAllFriendshipOfUser(String)} for a user already resolved.
     */
    public void deleteAllFriendshipOfUser(User user) {
        long deleted = friendshipRepository.removeAllInvolving(user.getId());
        log.debug("Removed {} friendships of {}", deleted, user.getUsername());
    }
}
