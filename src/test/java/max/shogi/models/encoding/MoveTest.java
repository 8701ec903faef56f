package max.shogi.models.encoding;

import max.shogi.engine.movegen.Move;
import max.shogi.engine.utils.PieceUtils;
import max.shogi.engine.utils.SquareUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MoveTest {

    @ParameterizedTest
    @ValueSource(bytes = {1, 2, 3, 4, 5, 6, 7, 8, 9, 12, 13, 14})
    public void testPieceTypeEncoding(byte pieceType) {
        // When
        int move = Move.asBytes(10, 20, pieceType, PieceUtils.NONE);

        // then
        assert Move.getPieceType(move) == pieceType;
    }

    @ParameterizedTest
    @ValueSource(bytes = {0, 1, 7, 9, 13, 14})
    public void testCapturedEncoding(byte captured) {
        // When
        int move = Move.asBytes(80, 0, PieceUtils.DRAGON, captured, true);

        // then
        assert Move.getCaptured(move) == captured;
        assert Move.isCapture(move) == (captured != PieceUtils.NONE);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 8, 40, 72, 80})
    public void testSquareEncoding(int square) {
        // When
        int from = Move.asBytes(square, 0, PieceUtils.GOLD, PieceUtils.NONE);
        int to = Move.asBytes(0, square, PieceUtils.GOLD, PieceUtils.NONE);

        // then
        assert Move.getFrom(from) == square;
        assert Move.getTo(to) == square;
    }

    @Test
    public void testPromotionEncoding() {
        // When
        int promoted = Move.asBytes(SquareUtils.square(2, 4), SquareUtils.square(2, 3), PieceUtils.PAWN, PieceUtils.NONE, true);
        int plain = Move.asBytes(SquareUtils.square(2, 4), SquareUtils.square(2, 3), PieceUtils.PAWN, PieceUtils.NONE, false);

        // then
        assertTrue(Move.isPromotion(promoted));
        assertFalse(Move.isPromotion(plain));
        assertEquals(PieceUtils.PRO_PAWN, Move.getResultingType(promoted));
        assertEquals(PieceUtils.PAWN, Move.getResultingType(plain));
        assertNotEquals(promoted, plain);
    }

    @Test
    public void testDropEncoding() {
        // When
        int drop = Move.asDrop(0, PieceUtils.PAWN);

        // then
        assertNotEquals(Move.NONE, drop);
        assertTrue(Move.isDrop(drop));
        assertFalse(Move.isPromotion(drop));
        assertFalse(Move.isCapture(drop));
        assertEquals(0, Move.getTo(drop));
        assertEquals(PieceUtils.PAWN, Move.getPieceType(drop));
    }

    @Test
    public void testRecordRoundTrip() {
        // Given
        int move = Move.asBytes(SquareUtils.square(8, 8), SquareUtils.square(2, 2), PieceUtils.BISHOP, PieceUtils.BISHOP, true);

        // When
        Move decoded = Move.fromBytes(move);

        // then
        assertEquals(move, decoded.toBytes());
        assertEquals("8h2b+", decoded.toString());
    }
}
