package io.fooddelivery.profile;

import java.util.Optional;

public interface UserProfileRepository {
    Optional<UserProfile> findById(String userId);
    void save(UserProfile profile);
}
