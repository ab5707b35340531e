package com.fritter.repo;

import com.fritter.repo.domain.Friendship;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FriendshipRepository extends MongoRepository<Friendship, String>, FriendshipRepositoryCustom {
}
