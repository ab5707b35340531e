package com.fritter.service;

import com.fritter.converter.StringToUserConverter;
import com.fritter.exception.UserNotFoundException;
import com.fritter.repo.FriendshipRepository;
import com.fritter.repo.domain.Friendship;
import com.fritter.repo.domain.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Sort;

import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FriendshipCollection")
class FriendshipCollectionTest {

    private static final String ALICE_ID = "64b0f1a2c3d4e5f601234561";
    private static final String BOB_ID = "64b0f1a2c3d4e5f601234562";

    @Mock
    private FriendshipRepository friendshipRepository;

    @Mock
    private UserCollection userCollection;

    @Spy
    private StringToUserConverter userReferenceConverter = new StringToUserConverter();

    @InjectMocks
    private FriendshipCollection friendshipCollection;

    private User alice;
    private User bob;

    @BeforeEach
    void setUp() {
        alice = new User("alice", "pw", new Date());
        alice.setId(ALICE_ID);
        bob = new User("bob", "pw", new Date());
        bob.setId(BOB_ID);
    }

    @Test
    @DisplayName("addOne stores references to both users with a creation date and returns the re-read record")
    void addOne_savesReferencesAndReturnsResolvedRecord() {
        Friendship saved = new Friendship();
        saved.setId("f1");
        Friendship resolved = new Friendship(alice, bob, new Date());
        resolved.setId("f1");
        given(friendshipRepository.save(any(Friendship.class))).willReturn(saved);
        given(friendshipRepository.findById("f1")).willReturn(Optional.of(resolved));

        Friendship result = friendshipCollection.addOne(ALICE_ID, BOB_ID);

        ArgumentCaptor<Friendship> captor = ArgumentCaptor.forClass(Friendship.class);
        then(friendshipRepository).should().save(captor.capture());
        Friendship written = captor.getValue();
        assertThat(written.getUserOne().getId()).isEqualTo(ALICE_ID);
        assertThat(written.getUserOne().getUsername()).isNull();
        assertThat(written.getUserTwo().getId()).isEqualTo(BOB_ID);
        assertThat(written.getDateCreated()).isNotNull();

        assertThat(result).isSameAs(resolved);
        assertThat(result.getUserTwo().getUsername()).isEqualTo("bob");
    }

    @Test
    @DisplayName("addOne does not check for an existing friendship between the pair")
    void addOne_allowsDuplicates() {
        AtomicInteger ids = new AtomicInteger();
        given(friendshipRepository.save(any(Friendship.class))).willAnswer(invocation -> {
            Friendship f = invocation.getArgument(0);
            f.setId("f" + ids.incrementAndGet());
            return f;
        });
        given(friendshipRepository.findById(anyString())).willReturn(Optional.empty());

        Friendship first = friendshipCollection.addOne(ALICE_ID, BOB_ID);
        Friendship second = friendshipCollection.addOne(ALICE_ID, BOB_ID);

        assertThat(first.getId()).isNotEqualTo(second.getId());
        then(friendshipRepository).should(times(2)).save(any(Friendship.class));
        then(friendshipRepository).should(never()).findAllInvolving(anyString());
    }

    @Test
    @DisplayName("findOne returns the record when it exists")
    void findOne_found() {
        Friendship friendship = new Friendship(alice, bob, new Date());
        friendship.setId("f1");
        given(friendshipRepository.findById("f1")).willReturn(Optional.of(friendship));

        assertThat(friendshipCollection.findOne("f1")).contains(friendship);
    }

    @Test
    @DisplayName("findOne returns empty for an unknown id")
    void findOne_notFound() {
        given(friendshipRepository.findById("missing")).willReturn(Optional.empty());

        assertThat(friendshipCollection.findOne("missing")).isEmpty();
    }

    @Test
    @DisplayName("findAll sorts by dateCreated, newest first")
    void findAll_sortsByDateCreatedDescending() {
        given(friendshipRepository.findAll(any(Sort.class))).willReturn(List.of());

        friendshipCollection.findAll();

        ArgumentCaptor<Sort> captor = ArgumentCaptor.forClass(Sort.class);
        then(friendshipRepository).should().findAll(captor.capture());
        Sort.Order order = captor.getValue().getOrderFor("dateCreated");
        assertThat(order).isNotNull();
        assertThat(order.getDirection()).isEqualTo(Sort.Direction.DESC);
    }

    @Test
    @DisplayName("findAllFriendshipsOfUser queries by the resolved user id")
    void findAllFriendshipsOfUser_queriesBothRoles() {
        Friendship friendship = new Friendship(alice, bob, new Date());
        given(userCollection.findOneByUsername("alice")).willReturn(alice);
        given(friendshipRepository.findAllInvolving(ALICE_ID)).willReturn(List.of(friendship));

        List<Friendship> result = friendshipCollection.findAllFriendshipsOfUser("alice");

        assertThat(result).containsExactly(friendship);
    }

    @Test
    @DisplayName("findAllFriendshipsOfUser propagates an unknown username")
    void findAllFriendshipsOfUser_unknownUser() {
        given(userCollection.findOneByUsername("nobody")).willThrow(new UserNotFoundException("nobody"));

        assertThatThrownBy(() -> friendshipCollection.findAllFriendshipsOfUser("nobody"))
                .isInstanceOf(UserNotFoundException.class)
                .hasMessageContaining("nobody");
        then(friendshipRepository).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("deleteOne reports true when the store deleted a document")
    void deleteOne_deleted() {
        given(friendshipRepository.removeById("f1")).willReturn(1L);

        assertThat(friendshipCollection.deleteOne("f1")).isTrue();
    }

    @Test
    @DisplayName("deleteOne reports false when nothing matched")
    void deleteOne_nothingToDelete() {
        given(friendshipRepository.removeById("missing")).willReturn(0L);

        assertThat(friendshipCollection.deleteOne("missing")).isFalse();
    }

    @Test
    @DisplayName("deleteAllFriendshipOfUser issues a single delete for the resolved user id")
    void deleteAllFriendshipOfUser_singleDelete() {
        given(userCollection.findOneByUsername("alice")).willReturn(alice);
        given(friendshipRepository.removeAllInvolving(ALICE_ID)).willReturn(3L);

        friendshipCollection.deleteAllFriendshipOfUser("alice");

        then(friendshipRepository).should(times(1)).removeAllInvolving(ALICE_ID);
        then(friendshipRepository).shouldHaveNoMoreInteractions();
    }

    @Test
    @DisplayName("deleteAllFriendshipOfUser with a resolved user does not look the username up again")
    void deleteAllFriendshipOfUser_resolvedUser() {
        given(friendshipRepository.removeAllInvolving(BOB_ID)).willReturn(1L);

        friendshipCollection.deleteAllFriendshipOfUser(bob);

        then(userCollection).shouldHaveNoInteractions();
        then(friendshipRepository).should().removeAllInvolving(BOB_ID);
    }

    @Test
    @DisplayName("deleteAllFriendshipOfUser propagates an unknown username without deleting")
    void deleteAllFriendshipOfUser_unknownUser() {
        given(userCollection.findOneByUsername("nobody")).willThrow(new UserNotFoundException("nobody"));

        assertThatThrownBy(() -> friendshipCollection.deleteAllFriendshipOfUser("nobody"))
                .isInstanceOf(UserNotFoundException.class);
        then(friendshipRepository).shouldHaveNoInteractions();
    }
}
