package com.fritter.repo;

public interface UserRepositoryCustom {

	/**
	 * @return the number of user documents deleted (0 or 1)
	 */
	long removeById(String userId);
}
