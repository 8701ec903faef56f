package max.shogi.models.pieces.search;

import max.shogi.engine.game.Game;
import max.shogi.engine.game.InvalidPositionException;
import max.shogi.engine.movegen.Move;
import max.shogi.engine.search.MateSearchService;
import max.shogi.engine.search.PrincipalVariation;
import max.shogi.engine.search.SearchConfig;
import max.shogi.engine.search.SearchOptions;
import max.shogi.engine.search.SearchResult;
import max.shogi.engine.utils.ColorUtils;
import max.shogi.engine.utils.notations.MoveIOUtils;
import max.shogi.engine.utils.notations.SfenUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MateSearchServiceTest {
    private static final String MATE_IN_THREE = "8k/9/8G/9/6N2/9/9/9/K8 b Rp 1";
    private static final String MATE_IN_FIVE = "8k/9/9/9/9/9/9/9/K8 b RGG 1";

    private final MateSearchService service = new MateSearchService(new SearchConfig.Builder().debug(true).build());

    private static void assertSoundMate(String sfen, SearchResult result, int maxDepth) {
        assertTrue(result.isMate());
        assertEquals(1, result.moves().length % 2, "mating lines have odd length");
        assertTrue(result.moves().length <= maxDepth);
        assertTrue(PrincipalVariation.isSoundMate(SfenUtils.getGameFrom(sfen), result.moves()),
                MoveIOUtils.writeLine(result.moves()));
    }

    @Test
    public void headGoldDropShouldBeFoundAtDepthOne() {
        // Given
        String sfen = "7lk/7p1/8P/9/9/9/9/9/K8 b G 1";

        // When
        SearchResult result = service.search(SfenUtils.getGameFrom(sfen), ColorUtils.BLACK, new SearchOptions(1, 0));

        // Then
        assertSoundMate(sfen, result, 1);
        assertEquals(1, result.moves().length);
        assertEquals("G*1b", MoveIOUtils.writeUsi(result.moves()[0]));
        assertTrue(result.nodeCount() >= 1);
    }

    @Test
    public void rookMateShouldBeFound() {
        // Given
        String sfen = "4k4/3ppp3/9/9/9/9/9/9/K7R b - 1";

        // When
        SearchResult result = service.search(SfenUtils.getGameFrom(sfen), ColorUtils.BLACK, new SearchOptions(3, 0));

        // Then
        assertSoundMate(sfen, result, 3);
        assertEquals(1, result.moves().length);
        assertEquals(MoveIOUtils.parseSquare("1i"), Move.getFrom(result.moves()[0]));
        assertEquals(MoveIOUtils.parseSquare("1a"), Move.getTo(result.moves()[0]));
    }

    @Test
    public void defenderAlreadyInCheckShouldStillBeSearched() {
        // Given
        String sfen = "4k4/9/4R4/9/9/9/9/9/K8 b G 1";

        // When
        SearchResult result = service.search(SfenUtils.getGameFrom(sfen), ColorUtils.BLACK, new SearchOptions(3, 0));

        // Then
        assertSoundMate(sfen, result, 3);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 3, 5, 7})
    public void bareKingsShouldNeverBeMate(int depth) {
        // Given
        Game game = SfenUtils.getGameFrom("4k4/9/9/9/9/9/9/9/4K4 b - 1");

        // When
        SearchResult result = service.search(game, ColorUtils.BLACK, new SearchOptions(depth, 0));

        // Then
        assertFalse(result.isMate());
        assertEquals(0, result.moves().length);
        assertFalse(result.timedOut());
    }

    @Test
    public void openKingShouldNotBeMatedAtDepthOne() {
        // Given
        Game game = SfenUtils.getGameFrom("9/9/9/9/4k4/9/9/9/K8 b G 1");

        // When
        SearchResult result = service.search(game, ColorUtils.BLACK, new SearchOptions(1, 0));

        // Then
        assertFalse(result.isMate());
        assertEquals(0, result.moves().length);
    }

    @Test
    public void interpositionShouldPushTheMateToThreePlies() {
        // Given
        Game game = SfenUtils.getGameFrom(MATE_IN_THREE);

        // When
        SearchResult shallow = service.search(game, ColorUtils.BLACK, new SearchOptions(1, 0));
        SearchResult deep = service.search(game, ColorUtils.BLACK, new SearchOptions(3, 0));

        // Then
        assertFalse(shallow.isMate());
        assertSoundMate(MATE_IN_THREE, deep, 3);
        assertEquals(3, deep.moves().length);
    }

    @Test
    public void interpositionMateShouldBeFoundWithinFivePlies() {
        // When
        SearchResult result = service.search(SfenUtils.getGameFrom(MATE_IN_THREE), ColorUtils.BLACK, new SearchOptions(5, 0));

        // Then
        assertSoundMate(MATE_IN_THREE, result, 5);
    }

    @Test
    public void deeperSearchShouldKeepFindingTheMate() {
        // Given
        Game game = SfenUtils.getGameFrom(MATE_IN_THREE);
        List<Integer> lengths = new ArrayList<>();

        for (int depth = 3; depth <= 7; depth += 2) {
            // When
            SearchResult result = service.search(game, ColorUtils.BLACK, new SearchOptions(depth, 0));

            // Then
            assertSoundMate(MATE_IN_THREE, result, depth);
            lengths.add(result.moves().length);
        }
        // iterative deepening returns the shortest proof whatever the maximum depth
        assertEquals(List.of(3, 3, 3), lengths);
    }

    @Test
    public void rookAndTwoGoldsShouldMateInFive() {
        // Given
        Game game = SfenUtils.getGameFrom(MATE_IN_FIVE);
        MateSearchService withoutTT = new MateSearchService(new SearchConfig.Builder().useTT(false).debug(true).build());

        // When
        SearchResult shallow = service.search(game, ColorUtils.BLACK, new SearchOptions(3, 0));
        SearchResult result = service.search(game, ColorUtils.BLACK, new SearchOptions(5, 0));
        SearchResult plain = withoutTT.search(game, ColorUtils.BLACK, new SearchOptions(5, 0));

        // Then
        assertFalse(shallow.isMate());
        assertFalse(shallow.timedOut());
        assertSoundMate(MATE_IN_FIVE, result, 5);
        assertEquals(5, result.mateLength());
        assertTrue(Move.isDrop(result.moves()[0]));
        assertArrayEquals(result.moves(), plain.moves());
        assertTrue(plain.nodeCount() >= result.nodeCount());
    }

    @Test
    public void withoutTheDefenderPawnTheRookDropMatesAtOnce() {
        // Given
        String sfen = "8k/9/8G/9/6N2/9/9/9/K8 b R 1";

        // When
        SearchResult result = service.search(SfenUtils.getGameFrom(sfen), ColorUtils.BLACK, new SearchOptions(3, 0));

        // Then
        assertSoundMate(sfen, result, 3);
        assertEquals(1, result.moves().length);
        assertTrue(Move.isDrop(result.moves()[0]));
    }

    @Test
    public void searchShouldNotModifyTheCallerGame() {
        // Given
        Game game = SfenUtils.getGameFrom(MATE_IN_THREE);
        long key = game.zobristKey();

        // When
        service.search(game, ColorUtils.BLACK, new SearchOptions(5, 0));

        // Then
        assertEquals(MATE_IN_THREE, SfenUtils.getSfenFromGame(game));
        assertEquals(key, game.zobristKey());
    }

    @Test
    public void searchShouldBeDeterministic() {
        // Given
        Game game = SfenUtils.getGameFrom(MATE_IN_THREE);

        // When
        SearchResult first = service.search(game, ColorUtils.BLACK, new SearchOptions(5, 0));
        SearchResult second = service.search(game, ColorUtils.BLACK, new SearchOptions(5, 0));

        // Then
        assertArrayEquals(first.moves(), second.moves());
        assertEquals(first.nodeCount(), second.nodeCount());
    }

    @Test
    public void resultsShouldNotDependOnTranspositionTableOrOrdering() {
        // Given
        MateSearchService plain = new MateSearchService(new SearchConfig.Builder().useTT(false).orderMoves(false).debug(true).build());
        Game game = SfenUtils.getGameFrom(MATE_IN_THREE);

        // When
        SearchResult result = plain.search(game, ColorUtils.BLACK, new SearchOptions(5, 0));

        // Then
        assertSoundMate(MATE_IN_THREE, result, 5);
        assertEquals(3, result.moves().length);
    }

    @Test
    public void timeoutShouldReturnPromptlyWithoutMate() {
        // Given
        Game game = SfenUtils.getGameFrom("4k4/9/9/9/8R/9/9/9/4K4 b - 1");

        // When
        SearchResult result = service.search(game, ColorUtils.BLACK, new SearchOptions(99, 1));

        // Then
        assertFalse(result.isMate());
        assertTrue(result.timedOut());
        assertEquals(0, result.moves().length);
        assertTrue(result.elapsedMs() >= 1);
        assertTrue(result.elapsedMs() < 2_000, "overrun " + result.elapsedMs());
        assertTrue(result.nodeCount() > 0);
    }

    @Test
    public void hugeTimeoutShouldMeanNoTimeout() {
        // Given
        Game game = SfenUtils.getGameFrom(MATE_IN_THREE);

        // When
        SearchResult result = service.search(game, ColorUtils.BLACK, new SearchOptions(3, Long.MAX_VALUE));
        SearchResult justOver = service.search(game, ColorUtils.BLACK, new SearchOptions(3, Long.MAX_VALUE / 1_000_000L + 1));

        // Then
        assertFalse(result.timedOut());
        assertSoundMate(MATE_IN_THREE, result, 3);
        assertFalse(justOver.timedOut());
        assertTrue(justOver.isMate());
    }

    @Test
    public void resultLineShouldBeACopy() {
        // Given
        Game game = SfenUtils.getGameFrom(MATE_IN_THREE);
        SearchResult result = service.search(game, ColorUtils.BLACK, new SearchOptions(3, 0));
        int[] line = result.moves();

        // When
        line[0] = Move.NONE;
        SearchResult same = new SearchResult(true, result.moves(), result.nodeCount(), result.elapsedMs(), false);

        // Then
        assertSoundMate(MATE_IN_THREE, result, 3);
        assertEquals(result, same);
        assertEquals(result.hashCode(), same.hashCode());
    }

    @Test
    public void infoLinesShouldBeSentToTheSink() {
        // Given
        List<String> lines = new ArrayList<>();
        MateSearchService verbose = new MateSearchService(new SearchConfig.Builder().build(), lines::add);

        // When
        verbose.search(SfenUtils.getGameFrom(MATE_IN_THREE), ColorUtils.BLACK, new SearchOptions(3, 0));

        // Then
        assertTrue(lines.get(0).startsWith("info string mate search black"));
        assertTrue(lines.get(lines.size() - 1).contains("score mate 3"));
    }

    @Test
    public void findCheckmateShouldUseTheDefaultDepth() {
        // When
        SearchResult result = MateSearchService.findCheckmate(SfenUtils.getGameFrom(MATE_IN_THREE), ColorUtils.BLACK);

        // Then
        assertSoundMate(MATE_IN_THREE, result, 7);
    }

    @Test
    public void defaultOptionsShouldComeFromTheConfig() {
        // Given
        MateSearchService shallow = new MateSearchService(new SearchConfig.Builder().defaultMaxDepth(1).build());

        // When
        SearchResult result = shallow.search(SfenUtils.getGameFrom(MATE_IN_THREE), ColorUtils.BLACK);

        // Then
        assertFalse(result.isMate());
    }

    @Test
    public void invalidInputShouldFailFast() {
        // Given
        Game noWhiteKing = SfenUtils.getGameFrom("9/9/9/9/9/9/9/9/K8 b G 1");
        Game nifu = SfenUtils.getGameFrom("4k4/9/9/P8/9/P8/9/9/4K4 b - 1");
        Game tooManyPawns = SfenUtils.getGameFrom("4k4/4p4/9/9/9/9/9/9/4R3K b 18P 1");

        // Then
        assertThrows(InvalidPositionException.class, () -> service.search(noWhiteKing, ColorUtils.BLACK, new SearchOptions(3, 0)));
        assertThrows(InvalidPositionException.class, () -> service.search(nifu, ColorUtils.BLACK, new SearchOptions(3, 0)));
        assertThrows(InvalidPositionException.class, () -> service.search(tooManyPawns, ColorUtils.BLACK, new SearchOptions(3, 0)));
        assertThrows(IllegalArgumentException.class, () -> new SearchOptions(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new SearchOptions(3, -1));
        assertThrows(IllegalArgumentException.class, () -> service.search(nifu, 2, new SearchOptions(3, 0)));
    }
}
