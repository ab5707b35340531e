package com.fritter.repo;

import com.fritter.repo.domain.Friendship;

import java.util.List;

/**
 * Queries on the user references of a friendship, and deletes that report how many
 * documents the store actually removed.
 */
public interface FriendshipRepositoryCustom {

	/**
	 * Every friendship in which the user is either party.
	 */
	List<Friendship> findAllInvolving(String userId);

	/**
	 * @return the number of friendship documents deleted (0 or 1)
	 */
	long removeById(String friendshipId);

	/**
	 * Remove every friendship in which the user is either party, in a single delete.
	 *
	 * @return the number of friendship documents deleted
	 */
	long removeAllInvolving(String userId);
}
