package com.shopsense.catalog.service;

import com.shopsense.catalog.dto.UserProfileDTO;
import com.shopsense.catalog.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserProfileService {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public List<UserProfileDTO> getActiveProfiles() {
        List<UserProfileDTO> profiles = userRepository.findByEnabledTrue().stream()
                .map(UserProfileDTO::fromEntity)
                .toList();
        log.debug("Loaded {} active user profiles", profiles.size());
        return profiles;
    }

    @Transactional(readOnly = true)
    public Optional<UserProfileDTO> findProfile(UUID userId) {
        return userRepository.findById(userId).map(UserProfileDTO::fromEntity);
    }
}
