package com.civicintake.authservice.domain;

import com.civicintake.authservice.error.AuthenticationException;
import com.civicintake.authservice.error.ConflictException;
import com.civicintake.authservice.error.NotFoundException;
import com.civicintake.authservice.error.ValidationException;
import com.civicintake.security.catalog.Role;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Account registration, password login and administration.
 *
 * <p>Login does the same hashing work whether or not the email exists, so response time does
 * not reveal which emails are registered.
 */
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    static final String INVALID_CREDENTIALS_MESSAGE = "Invalid email or password";

    private final UserAccountRepository accounts;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;
    private final String unknownAccountHash;

    public AccountService(UserAccountRepository accounts, PasswordEncoder passwordEncoder, Clock clock) {
        this.accounts = accounts;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
        this.unknownAccountHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    /**
     * Creates an account.
     *
     * @param role requested role; null means {@link Role#DEFAULT}. Roles above USER cannot be
     *     chosen at signup and are granted by an administrator instead.
     * @throws ConflictException if the email is already registered
     */
    public UserAccount register(String name, String email, String password, String phone, Role role) {
        Role granted = role != null ? role : Role.DEFAULT;
        if (granted.level() > Role.USER.level()) {
            throw new ValidationException("Role '%s' cannot be chosen at signup".formatted(granted));
        }
        UserAccount account = new UserAccount(
                UUID.randomUUID().toString(),
                name.strip(),
                normalize(email),
                phone,
                passwordEncoder.encode(password),
                granted,
                clock.instant());
        if (!accounts.insert(account)) {
            throw new ConflictException("User already exists with this email");
        }
        log.info("Registered account {} with role {}", account.id(), granted);
        return account;
    }

    /**
     * Checks an email and password pair.
     *
     * @throws AuthenticationException if the email is unknown or the password does not match
     */
    public UserAccount authenticate(String email, String password) {
        var account = accounts.findByEmail(normalize(email));
        String hash = account.map(UserAccount::passwordHash).orElse(unknownAccountHash);
        boolean matches = passwordEncoder.matches(password, hash);
        if (account.isEmpty() || !matches) {
            log.info("Login failed for {}", account.map(UserAccount::id).orElse("unknown email"));
            throw new AuthenticationException(INVALID_CREDENTIALS_MESSAGE);
        }
        return account.get();
    }

    public List<UserAccount> findAll() {
        return accounts.findAll();
    }

    /**
     * @throws NotFoundException if no account has the id
     */
    public UserAccount get(String id) {
        return accounts.findById(id).orElseThrow(() -> new NotFoundException("User not found"));
    }

    /**
     * @throws NotFoundException if no account has the id
     */
    public void delete(String id) {
        if (!accounts.deleteById(id)) {
            throw new NotFoundException("User not found");
        }
        log.info("Deleted account {}", id);
    }

    /**
     * @throws NotFoundException if no account has the id
     */
    public UserAccount changeRole(String id, Role role) {
        UserAccount updated = get(id).withRole(role);
        if (!accounts.update(updated)) {
            throw new NotFoundException("User not found");
        }
        log.info("Changed role of account {} to {}", id, role);
        return updated;
    }

    /**
     * Creates the administrator account unless one with the email already exists.
     *
     * @return true if an account was created
     */
    public boolean ensureAdministrator(String email, String password, String name) {
        if (accounts.findByEmail(email).isPresent()) {
            return false;
        }
        UserAccount admin = new UserAccount(
                UUID.randomUUID().toString(),
                name,
                normalize(email),
                null,
                passwordEncoder.encode(password),
                Role.ADMIN,
                clock.instant());
        return accounts.insert(admin);
    }

    private static String normalize(String email) {
        return email == null ? "" : email.strip().toLowerCase(Locale.ROOT);
    }
}
