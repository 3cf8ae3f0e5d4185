package com.contentgrid.oidc.security.jwt.issuer.jwk.source;

import com.contentgrid.oidc.storage.KeyStorageException;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodically drops expired keys from the published key set. Readers already ignore expired keys, this only keeps
 * the stored set from growing.
 */
@Slf4j
@RequiredArgsConstructor
public class ExpiredKeySweeper {

    private final PublicKeyPublisher publisher;
    private final Clock clock;

    @Scheduled(
            fixedDelayString = "${contentgrid.oidc.keys.sweep-interval:PT5M}",
            initialDelayString = "${contentgrid.oidc.keys.sweep-interval:PT5M}"
    )
    public void sweep() {
        try {
            var removed = publisher.removeExpired(clock.instant());
            log.debug("Expired key sweep removed {} keys", removed);
        } catch (KeyStorageException e) {
            log.warn("Expired key sweep failed, retrying on the next run", e);
        }
    }
}
