package io.fooddelivery.profile;

import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryUserProfileRepository implements UserProfileRepository {

    private final Map<String, UserProfile> profiles = new ConcurrentHashMap<>();

    @Override
    public Optional<UserProfile> findById(String userId) {
        return Optional.ofNullable(profiles.get(userId));
    }

    @Override
    public void save(UserProfile profile) {
        Objects.requireNonNull(profile, "profile cannot be null");
        profiles.put(profile.userId(), profile);
    }

    public int count() {
        return profiles.size();
    }
}
