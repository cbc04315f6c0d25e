package throttle.java.store.redis;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Lua script loaded from the classpath, with the SHA1 digest Redis uses to cache it.
 *
 * <p>With {@code frozenTime} the store clock can be pinned from tests: when the keys
 * {@code frozen_second} and {@code frozen_microsecond} exist they replace the TIME reply.
 */
final class LuaScript {

    static final String FROZEN_SECOND_KEY = "frozen_second";
    static final String FROZEN_MICROSECOND_KEY = "frozen_microsecond";

    private static final String RESOURCE_DIR = "/throttle/lua/";
    private static final String TIME_CALL = "local time = redis.call(\"time\")";
    private static final String FROZEN_TIME_CALL = String.join("\n",
        "local time",
        "if redis.call(\"exists\", \"" + FROZEN_SECOND_KEY + "\") == 1 then",
        "  time = redis.call(\"mget\", \"" + FROZEN_SECOND_KEY + "\", \"" + FROZEN_MICROSECOND_KEY + "\")",
        "else",
        "  time = redis.call(\"time\")",
        "end");

    private final String name;
    private final String source;
    private final String sha1;

    private LuaScript(String name, String source) {
        this.name = name;
        this.source = source;
        this.sha1 = sha1Hex(source);
    }

    static LuaScript load(String fileName, boolean frozenTime) {
        String source = readResource(RESOURCE_DIR + fileName);
        if (frozenTime) {
            source = source.replace(TIME_CALL, FROZEN_TIME_CALL);
        }
        return new LuaScript(fileName, source);
    }

    String name() {
        return name;
    }

    String source() {
        return source;
    }

    String sha1() {
        return sha1;
    }

    private static String readResource(String path) {
        try (InputStream in = LuaScript.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Lua script not found on classpath: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read Lua script " + path, e);
        }
    }

    private static String sha1Hex(String source) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(source.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
