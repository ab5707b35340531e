package com.fritter.repo.domain;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.DBRef;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Date;

/**
 * A mutual connection between two users. The pair is unordered; the same two users
 * may appear as (userOne, userTwo) or (userTwo, userOne).
 */
@Document(collection = "friendships")
public class Friendship {

    @Id
    private String id;

    @DBRef
    private User userOne;

    @DBRef
    private User userTwo;

    private Date dateCreated;

    public Friendship() {
    }

    public Friendship(User userOne, User userTwo, Date dateCreated) {
        this.userOne = userOne;
        this.userTwo = userTwo;
        this.dateCreated = dateCreated;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public User getUserOne() {
        return userOne;
    }

    public void setUserOne(User userOne) {
        this.userOne = userOne;
    }

    public User getUserTwo() {
        return userTwo;
    }

    public void setUserTwo(User userTwo) {
        this.userTwo = userTwo;
    }

    public Date getDateCreated() {
        return dateCreated;
    }

    public void setDateCreated(Date dateCreated) {
        this.dateCreated = dateCreated;
    }
}
