package com.fritter.repo;

import com.fritter.repo.domain.Friendship;
import com.mongodb.client.result.DeleteResult;
import org.bson.types.ObjectId;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class FriendshipRepositoryImpl implements FriendshipRepositoryCustom {

	private final MongoTemplate mongoTemplate;

	@Autowired
	public FriendshipRepositoryImpl(MongoTemplate mongoTemplate) {
		this.mongoTemplate = mongoTemplate;
	}

	@Override
	public List<Friendship> findAllInvolving(String userId) {
		return mongoTemplate.find(involving(userId), Friendship.class);
	}

	@Override
	public long removeById(String friendshipId) {
		Query query = new Query(Criteria.where("_id").is(toStoredId(friendshipId)));
		DeleteResult result = mongoTemplate.remove(query, Friendship.class);
		return result.getDeletedCount();
	}

	@Override
	public long removeAllInvolving(String userId) {
		DeleteResult result = mongoTemplate.remove(involving(userId), Friendship.class);
		return result.getDeletedCount();
	}

	// same filter for find and delete, served by the userOne.$id / userTwo.$id indexes
	private Query involving(String userId) {
		return new Query(new Criteria().orOperator(
				referenceCriteria("userOne", userId),
				referenceCriteria("userTwo", userId)));
	}

	// @DBRef fields are stored as { $ref, $id }, match on the referenced id
	private Criteria referenceCriteria(String field, String userId) {
		return Criteria.where(field + ".$id").is(toStoredId(userId));
	}

	private Object toStoredId(String id) {
		if (id != null && ObjectId.isValid(id)) {
			return new ObjectId(id);
		}
		// not an ObjectId, fall back to string comparison
		return id;
	}
}
