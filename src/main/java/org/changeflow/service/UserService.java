package org.changeflow.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.changeflow.models.entity.ApplicationUser;
import org.changeflow.repository.UserRepository;
import org.changeflow.utils.AppUtils;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.util.Locale;

/**
 * Local directory of actors. Identity is issued elsewhere; a user row is created the first time an email
 * shows up as a token subject or as a project member.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;

    @Transactional
    public ApplicationUser resolve(String email, String displayName) {
        if (!StringUtils.hasText(email)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Email is required");
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        return userRepository.findByEmailIgnoreCase(normalized).orElseGet(() -> {
            String name = StringUtils.hasText(displayName) ? displayName.trim() : defaultName(normalized);
            ApplicationUser user = userRepository.save(new ApplicationUser(AppUtils.generateUUID(), name, normalized));
            log.info("Registered user {}", normalized);
            return user;
        });
    }

    @Transactional
    public ApplicationUser resolve(String email) {
        return resolve(email, null);
    }

    private String defaultName(String email) {
        int at = email.indexOf('@');
        String local = at > 0 ? email.substring(0, at) : email;
        return local.length() > 60 ? local.substring(0, 60) : local;
    }
}
