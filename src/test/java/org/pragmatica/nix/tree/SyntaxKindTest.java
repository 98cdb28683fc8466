package org.pragmatica.nix.tree;

import com.google.common.base.VerifyException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SyntaxKindTest {

    @Test
    void fromRaw_everyKind_roundTrips() {
        for (var kind : SyntaxKind.values()) {
            assertEquals(kind, SyntaxKind.fromRaw(kind.toRaw()));
        }
    }

    @Test
    void last_isHighestTag() {
        assertEquals(SyntaxKind.values().length - 1, SyntaxKind.LAST);
    }

    @Test
    void fromRaw_outOfRange_isFatal() {
        assertThrows(VerifyException.class, () -> SyntaxKind.fromRaw(SyntaxKind.LAST + 1));
        assertThrows(VerifyException.class, () -> SyntaxKind.fromRaw(-1));
    }

    @Test
    void tokensAndNodes_partitionKinds() {
        for (var kind : SyntaxKind.values()) {
            assertNotEquals(kind.isToken(), kind.isNode(), kind::name);
        }
        assertTrue(SyntaxKind.TOKEN_WHITESPACE.isTrivia());
        assertTrue(SyntaxKind.TOKEN_COMMENT.isTrivia());
        assertFalse(SyntaxKind.TOKEN_ERROR.isTrivia());
    }

    @Test
    void isFnArg_acceptsValueStarts() {
        assertThat(SyntaxKind.values()).filteredOn(SyntaxKind::isFnArg)
                                       .containsExactlyInAnyOrder(SyntaxKind.TOKEN_REC,
                                                                  SyntaxKind.TOKEN_L_BRACE,
                                                                  SyntaxKind.TOKEN_L_BRACK,
                                                                  SyntaxKind.TOKEN_L_PAREN,
                                                                  SyntaxKind.TOKEN_STRING_START,
                                                                  SyntaxKind.TOKEN_IDENT,
                                                                  SyntaxKind.TOKEN_OR,
                                                                  SyntaxKind.TOKEN_PATH,
                                                                  SyntaxKind.TOKEN_FLOAT,
                                                                  SyntaxKind.TOKEN_INTEGER,
                                                                  SyntaxKind.TOKEN_URI);
    }
}
