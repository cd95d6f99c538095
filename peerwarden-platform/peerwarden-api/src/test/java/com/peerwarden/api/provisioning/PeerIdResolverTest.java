package com.peerwarden.api.provisioning;

import com.peerwarden.api.router.PeerFields;
import com.peerwarden.api.support.InMemoryRouterClient;
import com.peerwarden.routeros.CreateOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PeerIdResolverTest {

    private static final String KEY_A = "AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA=";
    private static final String KEY_B = "BBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBA=";

    private InMemoryRouterClient router;
    private PeerIdResolver resolver;

    @BeforeEach
    void setUp() {
        router = new InMemoryRouterClient();
        resolver = new PeerIdResolver(router);
    }

    @Test
    void directAndNestedIdsAreUsedAsIs() {
        PeerFields fields = submitted("laptop", KEY_A);

        assertThat(resolver.resolve(new CreateOutcome.DirectId("*7"), fields)).isEqualTo("*7");
        assertThat(resolver.resolve(new CreateOutcome.NestedId("*8"), fields)).isEqualTo("*8");
    }

    @Test
    void missingIdIsFoundByPublicKeyAndComment() {
        router.seed("laptop", KEY_B, "172.16.0.2/32");
        router.seed("phone", KEY_A, "172.16.0.3/32");
        String expected = router.seed("laptop", KEY_A, "172.16.0.4/32").id();

        assertThat(resolver.resolve(new CreateOutcome.NoId("[]"), submitted("laptop", KEY_A))).isEqualTo(expected);
    }

    @Test
    void unresolvableIdFailsAndLeavesRouterUntouched() {
        router.seed("laptop", KEY_B, "172.16.0.2/32");

        assertThatThrownBy(() -> resolver.resolve(new CreateOutcome.NoId(""), submitted("laptop", KEY_A)))
                .isInstanceOf(PeerIdResolutionFailedException.class)
                .hasMessage("Failed to get ID for newly created peer");
        assertThat(router.peerIds()).hasSize(1);
        assertThat(router.deletedIds()).isEmpty();
    }

    private static PeerFields submitted(String comment, String publicKey) {
        return PeerFields.forCreate("wg-test", publicKey, "172.16.0.9/32", comment, false, null);
    }
}
