package com.afipvision.core.db;

import com.afipvision.app.Config;
import com.afipvision.core.ocr.Provider;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ThreadLocalRandom;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PgQuotaStoreTest {

    @Test
    void blankUrlIsRejected() {
        assertThrows(IllegalStateException.class, () -> new PgQuotaStore(new Config.Db(" ", "u", "p")));
        assertThrows(IllegalStateException.class, () -> new PgQuotaStore(new Config.Db(null, "u", "p")));
    }

    @Test
    void incrementIsPerProviderAndDay() {
        // живая база: -Dav.pg.url=jdbc:postgresql://... -Dav.pg.user=... -Dav.pg.pass=...
        String url = System.getProperty("av.pg.url");
        assumeTrue(url != null && !url.isBlank(), "av.pg.url not set");
        Config.Db db = new Config.Db(url, System.getProperty("av.pg.user"), System.getProperty("av.pg.pass"));

        // случайный день в далёком будущем, чтобы не пересекаться с реальными счётчиками
        long day = 50_000 + ThreadLocalRandom.current().nextInt(100_000);
        Clock clock = Clock.fixed(Instant.ofEpochSecond(day * 86_400), ZoneOffset.UTC);
        try (PgQuotaStore s = new PgQuotaStore(db, clock)) {
            int before = s.currentCount(Provider.CLOUD_A);
            assertEquals(before + 1, s.increment(Provider.CLOUD_A));
            assertEquals(before + 2, s.increment(Provider.CLOUD_A));
            assertEquals(before + 2, s.currentCount(Provider.CLOUD_A));
            assertEquals(s.currentCount(Provider.CLOUD_B), s.increment(Provider.CLOUD_B) - 1);
        }
    }
}
