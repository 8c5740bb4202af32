package com.dailyBrief.accountBrief.account.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Contents of the secondary account file.
 *
 * <pre>
 * {"accounts": [
 *   {"email": "me@corp.example", "type": "work",
 *    "imap_server": "imap.corp.example", "imap_port": 993, "use_ssl": true,
 *    "username": "me", "password": "..."},
 *   {"email": "other@corp.example", "source": "provider"}
 * ]}
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConfiguredAccounts {

    @JsonAlias("imap_accounts")
    private List<ConfiguredAccount> accounts;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConfiguredAccount {
        private String email;

        /**
         * "personal" or "work"; derived from the domain when absent.
         */
        private String type;

        /**
         * "imap" (default) or "provider".
         */
        private String source;

        @JsonProperty("imap_server")
        private String imapServer;

        @JsonProperty("imap_port")
        private Integer imapPort;

        @JsonProperty("use_ssl")
        private Boolean useSsl;

        private String username;

        @ToString.Exclude
        private String password;
    }
}
