package com.ideabridge.backend.modules.auth.domain;

import java.util.UUID;

import com.ideabridge.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Registered account. The username/password pair and the mobile number are mutually exclusive and
 * are only ever written through {@link #register(Identity, boolean)}.
 */
@Entity
@Table(name = "app_user")
public class AppUser extends AbstractTimestampedEntity {

    public static final String UK_USERNAME = "uk_app_user_username";
    public static final String UK_MOBILE_NUMBER = "uk_app_user_mobile_number";

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "username", unique = true, length = 30)
    private String username;

    @Column(name = "password_hash", length = 255)
    private String passwordHash;

    @Column(name = "mobile_number", unique = true, length = 16)
    private String mobileNumber;

    @Column(name = "email", length = 320)
    private String email;

    @Column(name = "name", length = 100)
    private String name;

    @Column(name = "is_admin", nullable = false)
    private boolean admin;

    protected AppUser() {
    }

    public static AppUser register(Identity identity) {
        return register(identity, false);
    }

    public static AppUser register(Identity identity, boolean admin) {
        AppUser user = new AppUser();
        if (identity instanceof Identity.Credentials credentials) {
            user.username = credentials.username();
            user.passwordHash = credentials.passwordHash();
        } else if (identity instanceof Identity.Mobile mobile) {
            user.mobileNumber = mobile.mobileNumber();
        } else {
            throw new IllegalArgumentException("Unsupported identity: " + identity);
        }
        user.admin = admin;
        return user;
    }

    public Identity getIdentity() {
        if (username != null && passwordHash != null) {
            return new Identity.Credentials(username, passwordHash);
        }
        if (mobileNumber != null) {
            return new Identity.Mobile(mobileNumber);
        }
        throw new IllegalStateException("User " + id + " has no proof method");
    }

    public boolean hasPassword() {
        return passwordHash != null;
    }

    public UserProfile toProfile() {
        return new UserProfile(id, username, mobileNumber, email, name, admin, getCreatedAt(), getUpdatedAt());
    }

    public UUID getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public String getMobileNumber() {
        return mobileNumber;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isAdmin() {
        return admin;
    }
}
