package com.fritter.repo;

import com.fritter.repo.domain.User;
import com.mongodb.client.result.DeleteResult;
import org.bson.types.ObjectId;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

@Repository
public class UserRepositoryImpl implements UserRepositoryCustom {

	private final MongoTemplate mongoTemplate;

	@Autowired
	public UserRepositoryImpl(MongoTemplate mongoTemplate) {
		this.mongoTemplate = mongoTemplate;
	}

	@Override
	public long removeById(String userId) {
		Object storedId = userId != null && ObjectId.isValid(userId) ? new ObjectId(userId) : userId;
		DeleteResult result = mongoTemplate.remove(new Query(Criteria.where("_id").is(storedId)), User.class);
		return result.getDeletedCount();
	}
}
