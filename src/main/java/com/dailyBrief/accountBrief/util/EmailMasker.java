package com.dailyBrief.accountBrief.util;

/**
 * Utility class for masking account emails in logs.
 */
public class EmailMasker {

    private EmailMasker() {}

    /**
     * Keeps the first 2 characters of the local part and the whole domain.
     *
     * @param email The email to mask
     * @return Masked email (e.g., "jo****@example.com"), or "****" when too short to mask
     */
    public static String mask(String email) {
        if (email == null) {
            return "****";
        }
        int at = email.indexOf('@');
        if (at < 0) {
            return email.length() <= 4
                    ? "****"
                    : email.substring(0, 2) + "****" + email.substring(email.length() - 2);
        }
        String local = email.substring(0, at);
        String prefix = local.length() <= 2 ? "" : local.substring(0, 2);
        return prefix + "****" + email.substring(at);
    }
}
