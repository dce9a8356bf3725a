package com.iksanov.respcache.server.command;

import com.iksanov.respcache.common.exception.CacheException;
import com.iksanov.respcache.common.exception.CommandException;
import com.iksanov.respcache.common.resp.Reply;
import com.iksanov.respcache.common.resp.RespCommand;
import com.iksanov.respcache.server.config.ReplicationInfo;
import com.iksanov.respcache.server.config.ServerParameters;
import com.iksanov.respcache.server.core.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * CommandProcessor maps a decoded {@link RespCommand} to a {@link Reply}.
 * <p>
 * This class isolates the network layer (Netty) from the store:
 *  - resolves the command name case-insensitively
 *  - validates arity and arguments
 *  - converts every failure into an error reply; {@link #process} never throws
 * <p>
 * Thread-safe: holds only the shared store and immutable configuration.
 */
public class CommandProcessor {

    private static final Logger log = LoggerFactory.getLogger(CommandProcessor.class);
    private static final String INTERNAL_ERROR = "ERR internal error";
    private final CacheStore store;
    private final ServerParameters parameters;
    private final ReplicationInfo replication;

    public CommandProcessor(CacheStore store, ServerParameters parameters, ReplicationInfo replication) {
        this.store = Objects.requireNonNull(store, "store");
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.replication = Objects.requireNonNull(replication, "replication");
    }

    public Reply process(RespCommand command) {
        Objects.requireNonNull(command, "command");
        try {
            CommandType type = CommandType.fromName(command.name());
            type.checkArity(command.arity());
            return switch (type) {
                case PING -> Reply.PONG;
                case ECHO -> Reply.bulk(command.argument(1));
                case SET -> handleSet(command);
                case GET -> handleGet(command);
                case CONFIG -> handleConfig(command);
                case INFO -> handleInfo(command);
            };
        } catch (CacheException ce) {
            log.debug("Command {} rejected: {}", command.name(), ce.getMessage());
            return Reply.error(ce.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error while processing command {}", command.name(), e);
            return Reply.error(INTERNAL_ERROR);
        }
    }

    private Reply handleSet(RespCommand command) {
        byte[] key = command.argument(1);
        byte[] value = command.argument(2);
        if (command.arity() == 3) {
            store.set(key, value);
            return Reply.OK;
        }
        // SET key value PX ms; a dangling option is a syntax error
        if (command.arity() != 5 || !"PX".equalsIgnoreCase(command.argumentAsString(3))) {
            throw CommandException.syntaxError();
        }
        long ttlMillis = parseNonNegativeLong(command.argumentAsString(4));
        store.set(key, value, ttlMillis);
        log.trace("SET key={} px={}", command.argumentAsString(1), ttlMillis);
        return Reply.OK;
    }

    private Reply handleGet(RespCommand command) {
        byte[] value = store.get(command.argument(1));
        if (value == null) {
            log.trace("GET miss for key={}", command.argumentAsString(1));
            return Reply.NULL;
        }
        return Reply.bulk(value);
    }

    private Reply handleConfig(RespCommand command) {
        String subcommand = command.argumentAsString(1);
        if (!"GET".equalsIgnoreCase(subcommand)) {
            throw new CommandException("ERR unknown subcommand '" + subcommand + "'");
        }
        String name = command.argumentAsString(2).toLowerCase(Locale.ROOT);
        Optional<String> value = parameters.get(name);
        if (value.isEmpty()) return Reply.emptyArray();
        return Reply.array(List.of(Reply.bulk(name), Reply.bulk(value.get())));
    }

    private Reply handleInfo(RespCommand command) {
        String section = command.arity() == 2 ? command.argumentAsString(1).toLowerCase(Locale.ROOT) : "replication";
        return switch (section) {
            case "replication", "all", "default", "everything" -> Reply.bulk(replication.toInfoSection());
            default -> Reply.bulk("");
        };
    }

    private static long parseNonNegativeLong(String text) {
        // digits only: Long.parseLong alone would also take a leading '+' or '-'
        if (text.isEmpty() || !text.chars().allMatch(c -> c >= '0' && c <= '9')) throw CommandException.notAnInteger();
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw CommandException.notAnInteger();
        }
    }
}
