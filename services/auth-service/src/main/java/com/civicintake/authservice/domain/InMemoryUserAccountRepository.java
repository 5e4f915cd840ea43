package com.civicintake.authservice.domain;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local account store. Accounts do not survive a restart.
 *
 * <p>Email uniqueness is enforced by claiming the email in a second map before the account is
 * stored, so two concurrent signups with one email cannot both succeed.
 */
public class InMemoryUserAccountRepository implements UserAccountRepository {

    private final Map<String, UserAccount> byId = new ConcurrentHashMap<>();
    private final Map<String, String> idByEmail = new ConcurrentHashMap<>();

    @Override
    public Optional<UserAccount> findById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    @Override
    public Optional<UserAccount> findByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(idByEmail.get(normalize(email))).map(byId::get);
    }

    @Override
    public List<UserAccount> findAll() {
        return byId.values().stream()
                .sorted(Comparator.comparing(UserAccount::createdAt).thenComparing(UserAccount::id))
                .toList();
    }

    @Override
    public boolean insert(UserAccount account) {
        if (idByEmail.putIfAbsent(normalize(account.email()), account.id()) != null) {
            return false;
        }
        byId.put(account.id(), account);
        return true;
    }

    @Override
    public boolean update(UserAccount account) {
        return byId.computeIfPresent(account.id(), (id, existing) -> account) != null;
    }

    @Override
    public boolean deleteById(String id) {
        UserAccount removed = byId.remove(id);
        if (removed == null) {
            return false;
        }
        idByEmail.remove(normalize(removed.email()), id);
        return true;
    }

    private static String normalize(String email) {
        return email.strip().toLowerCase(Locale.ROOT);
    }
}
