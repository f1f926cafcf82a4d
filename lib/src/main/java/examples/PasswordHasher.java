package examples;

import com.cajunsystems.service.Service;
import com.cajunsystems.service.ServiceHandle;
import com.cajunsystems.service.declaration.Bindings;
import com.cajunsystems.service.mode.PooledHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static com.cajunsystems.service.declaration.ClauseBody.reply;
import static com.cajunsystems.service.declaration.ClauseBody.setState;

/**
 * A pool of hashing workers. Each worker counts the hashes it computed, so the state of a
 * pooled worker is private to it.
 */
public final class PasswordHasher {

    private static final Logger logger = LoggerFactory.getLogger(PasswordHasher.class);

    private static final int ROUNDS = 1_000;

    private PasswordHasher() {
    }

    public static Service<Long> declare(int min, int max) {
        return Service.<Long>builder("password-hasher")
                .pooled(min, max)
                .withInitialState(0L)
                .withStateName("hashed")
                .function("hash(password, salt)",
                        setState(b -> b.getLong("hashed") + 1, PasswordHasher::digest))
                .function("count()", reply(b -> b.get("hashed")))
                .build();
    }

    private static Object digest(Bindings bindings) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            byte[] value = (bindings.<String>get("salt") + bindings.<String>get("password"))
                    .getBytes(StandardCharsets.UTF_8);
            for (int i = 0; i < ROUNDS; i++) {
                value = sha.digest(value);
            }
            return HexFormat.of().formatHex(value);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static void main(String[] args) {
        Service<Long> hasher = declare(1, 4);
        ServiceHandle<Long> handle = hasher.run();

        List<CompletableFuture<Object>> hashes = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            hashes.add(hasher.function("hash").callAsync(handle, "secret-" + i, "salt"));
        }
        CompletableFuture.allOf(hashes.toArray(new CompletableFuture[0])).join();
        logger.info("Computed {} hashes, pool {}", hashes.size(), ((PooledHandle<Long>) handle).stats());

        hasher.stop(handle);
    }
}
