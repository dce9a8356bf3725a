package com.iksanov.respcache.server.config;

import java.util.Objects;

/**
 * Replication descriptor reported by {@code INFO replication}.
 * No replication traffic exists; the role only reflects whether {@code replicaof} was configured.
 */
public record ReplicationInfo(Role role, String masterHost, int masterPort, String replicationId, long offset) {

    public static final String DEFAULT_REPLICATION_ID = "8371b4fb1155b71f4a04d3e1bc3e18c4a990aeeb";

    public enum Role {
        MASTER("master"),
        SLAVE("slave");

        private final String wireName;

        Role(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    public ReplicationInfo {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(replicationId, "replicationId");
    }

    public static ReplicationInfo master() {
        return new ReplicationInfo(Role.MASTER, null, 0, DEFAULT_REPLICATION_ID, 0);
    }

    public static ReplicationInfo replicaOf(String host, int port) {
        return new ReplicationInfo(Role.SLAVE, Objects.requireNonNull(host, "host"), port, DEFAULT_REPLICATION_ID, 0);
    }

    /**
     * @return the body of the {@code # Replication} INFO section, CRLF separated
     */
    public String toInfoSection() {
        StringBuilder sb = new StringBuilder("# Replication\r\n");
        sb.append("role:").append(role.wireName()).append("\r\n");
        if (role == Role.SLAVE) {
            sb.append("master_host:").append(masterHost).append("\r\n");
            sb.append("master_port:").append(masterPort).append("\r\n");
        }
        sb.append("master_replid:").append(replicationId).append("\r\n");
        sb.append("master_repl_offset:").append(offset).append("\r\n");
        return sb.toString();
    }
}
