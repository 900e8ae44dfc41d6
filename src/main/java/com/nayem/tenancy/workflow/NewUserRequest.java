package com.nayem.tenancy.workflow;

import com.nayem.tenancy.identity.NewExternalUser;

import java.util.Objects;

/**
 * A user to provision.
 *
 * @param password Initial password, or null to let the user set one through an emailed link
 */
public record NewUserRequest(String email, String firstName, String lastName, String password) {

    public NewUserRequest {
        Objects.requireNonNull(email, "email");
    }

    NewExternalUser toExternalUser() {
        return password != null
                ? NewExternalUser.withPassword(email, firstName, lastName, password)
                : NewExternalUser.invitation(email, firstName, lastName);
    }

    @Override
    public String toString() {
        return "NewUserRequest[email=" + email + ", firstName=" + firstName + ", lastName=" + lastName + "]";
    }
}
