package com.flagship.gate_ledger.identity;

/**
 * The two identity variants a registration number can belong to.
 *
 * Both variants share one keyspace: a regNo is registered under at most
 * one of them at any time.
 */
public enum IdentityType {
    STUDENT,
    STAFF;

    /**
     * Routes a regNo to a variant before the identity exists.
     *
     * Naming convention only: staff numbers start with an ASCII letter,
     * student numbers do not. Never consulted once the identity is registered.
     *
     * @param regNo registration number, already trimmed
     * @return STAFF if the first character is a-z or A-Z, STUDENT otherwise
     */
    public static IdentityType classify(String regNo) {
        if (regNo == null || regNo.isEmpty()) {
            throw new IllegalArgumentException("Registration number is required");
        }
        return isAsciiLetter(regNo.charAt(0)) ? STAFF : STUDENT;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
