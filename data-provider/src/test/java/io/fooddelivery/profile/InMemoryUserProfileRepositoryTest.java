package io.fooddelivery.profile;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryUserProfileRepositoryTest {

    private InMemoryUserProfileRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryUserProfileRepository();
    }

    @Test
    void shouldFindSavedProfile() {
        var profile = new UserProfile("ana@example.com", "123 Main St");

        repository.save(profile);

        assertThat(repository.findById("ana@example.com")).containsSame(profile);
    }

    @Test
    void shouldReturnEmptyForUnknownUser() {
        assertThat(repository.findById("nobody@example.com")).isEmpty();
    }

    @Test
    void shouldReplaceProfileWithSameUserId() {
        repository.save(new UserProfile("ana@example.com", "123 Main St"));
        var updated = new UserProfile("ana@example.com", "456 Elm St");

        repository.save(updated);

        assertThat(repository.count()).isEqualTo(1);
        assertThat(repository.findById("ana@example.com")).get()
            .extracting(UserProfile::deliveryAddress)
            .isEqualTo("456 Elm St");
    }

    @Test
    void shouldRejectNullProfile() {
        assertThatThrownBy(() -> repository.save(null))
            .isInstanceOf(NullPointerException.class);
    }
}
