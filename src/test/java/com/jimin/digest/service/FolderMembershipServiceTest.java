package com.jimin.digest.service;

import com.jimin.digest.core.access.Tier;
import com.jimin.digest.dto.FolderRequest;
import com.jimin.digest.dto.FolderResponse;
import com.jimin.digest.entity.Item;
import com.jimin.digest.entity.SourceType;
import com.jimin.digest.entity.UserSubscription;
import com.jimin.digest.exception.FolderNotOwnedException;
import com.jimin.digest.exception.TierInsufficientException;
import com.jimin.digest.repository.FolderItemMembershipRepository;
import com.jimin.digest.repository.FolderRepository;
import com.jimin.digest.repository.ItemRepository;
import com.jimin.digest.repository.UserSubscriptionRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class FolderMembershipServiceTest {

    private static final String OWNER = "pro-owner";
    private static final String OTHER = "pro-other";
    private static final String FREE_USER = "free-user";

    @Autowired
    private FolderMembershipService membershipService;

    @Autowired
    private FolderService folderService;

    @Autowired
    private ItemRepository itemRepository;

    @Autowired
    private FolderRepository folderRepository;

    @Autowired
    private FolderItemMembershipRepository membershipRepository;

    @Autowired
    private UserSubscriptionRepository subscriptionRepository;

    private String itemId;

    @BeforeEach
    void setUp() {
        subscriptionRepository.save(subscription(OWNER, Tier.PRO));
        subscriptionRepository.save(subscription(OTHER, Tier.PRO));
        subscriptionRepository.save(subscription(FREE_USER, Tier.FREE));
        itemId = itemRepository.save(item()).getId();
    }

    @AfterEach
    void tearDown() {
        membershipRepository.deleteAll();
        folderRepository.deleteAll();
        itemRepository.deleteAll();
        subscriptionRepository.deleteAll();
    }

    @Test
    void addIsIdempotent() {
        Long folderId = folder(OWNER, "Reading");

        assertThat(membershipService.add(OWNER, folderId, itemId)).isTrue();
        assertThat(membershipService.add(OWNER, folderId, itemId)).isFalse();

        assertThat(membershipRepository.findByItemId(itemId)).hasSize(1);
        assertThat(membershipService.foldersOf(OWNER, itemId))
                .extracting(FolderResponse::id)
                .containsExactly(folderId);
    }

    @Test
    void removingAbsentMembershipReportsFalse() {
        Long folderId = folder(OWNER, "Empty");

        assertThat(membershipService.remove(OWNER, folderId, itemId)).isFalse();
    }

    @Test
    void removeInvalidatesFolderList() {
        Long first = folder(OWNER, "First");
        Long second = folder(OWNER, "Second");
        membershipService.add(OWNER, first, itemId);
        membershipService.add(OWNER, second, itemId);
        assertThat(membershipService.foldersOf(OWNER, itemId)).hasSize(2);

        assertThat(membershipService.remove(OWNER, first, itemId)).isTrue();

        assertThat(membershipService.foldersOf(OWNER, itemId))
                .extracting(FolderResponse::id)
                .containsExactly(second);
    }

    @Test
    void folderListShowsOnlyCallersFolders() {
        Long mine = folder(OWNER, "Mine");
        Long theirs = folder(OTHER, "Theirs");
        membershipService.add(OWNER, mine, itemId);
        membershipService.add(OTHER, theirs, itemId);

        assertThat(membershipService.foldersOf(OWNER, itemId))
                .extracting(FolderResponse::id)
                .containsExactly(mine);
    }

    @Test
    void cannotUseAnotherUsersFolder() {
        Long theirs = folder(OTHER, "Theirs");

        assertThatThrownBy(() -> membershipService.add(OWNER, theirs, itemId))
                .isInstanceOf(FolderNotOwnedException.class);
        assertThatThrownBy(() -> membershipService.remove(OWNER, theirs, itemId))
                .isInstanceOf(FolderNotOwnedException.class);
    }

    @Test
    void addRequiresPro() {
        Long folderId = folder(OWNER, "Reading");

        assertThatThrownBy(() -> membershipService.add(FREE_USER, folderId, itemId))
                .isInstanceOf(TierInsufficientException.class);
    }

    @Test
    void downgradedOwnerCannotChangeOrListMemberships() {
        Long folderId = folder(OWNER, "Reading");
        membershipService.add(OWNER, folderId, itemId);
        subscriptionRepository.save(subscription(OWNER, Tier.FREE));

        assertThatThrownBy(() -> membershipService.remove(OWNER, folderId, itemId))
                .isInstanceOf(TierInsufficientException.class);
        assertThatThrownBy(() -> membershipService.foldersOf(OWNER, itemId))
                .isInstanceOf(TierInsufficientException.class);
        assertThat(membershipRepository.findByItemId(itemId)).hasSize(1);
    }

    @Test
    void downgradedOwnerCanStillDeleteFolder() {
        Long folderId = folder(OWNER, "Old");
        membershipService.add(OWNER, folderId, itemId);
        subscriptionRepository.save(subscription(OWNER, Tier.PREMIUM));

        folderService.deleteFolder(OWNER, folderId);

        assertThat(membershipRepository.findByItemId(itemId)).isEmpty();
    }

    @Test
    void deletingFolderDropsMemberships() {
        Long folderId = folder(OWNER, "Temp");
        membershipService.add(OWNER, folderId, itemId);

        folderService.deleteFolder(OWNER, folderId);

        assertThat(membershipRepository.findByItemId(itemId)).isEmpty();
        assertThat(membershipService.foldersOf(OWNER, itemId)).isEmpty();
    }

    private Long folder(String userId, String name) {
        return folderService.createFolder(userId, new FolderRequest(name, null, null)).id();
    }

    private UserSubscription subscription(String userId, Tier tier) {
        UserSubscription subscription = new UserSubscription();
        subscription.setUserId(userId);
        subscription.setTier(tier);
        subscription.setUpdatedAt(LocalDateTime.now());
        return subscription;
    }

    private Item item() {
        Item item = new Item();
        item.setId(UUID.randomUUID().toString());
        item.setSourceType(SourceType.JOURNAL);
        item.setTitle("Time-restricted eating and sleep");
        item.setUrl("https://journal.example/" + item.getId());
        item.setPublishedAt(LocalDateTime.now().minusDays(1));
        item.setIngestedAt(LocalDateTime.now());
        item.getTopics().add("fasting");
        item.setHashDedupe(item.getId().replace("-", "") + "0000");
        return item;
    }
}
