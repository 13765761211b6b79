package io.usymbol.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.usymbol.core.config.ContextOptions;
import io.usymbol.core.config.OptionsLoadException;
import io.usymbol.core.error.ForeignExpressionException;
import io.usymbol.core.error.UndefinedExpressionException;
import io.usymbol.core.model.Expression;
import io.usymbol.core.model.InternStats;
import io.usymbol.core.model.Symbol;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

/** Tests for {@link ExpressionContext}: scoping, lifecycle, helpers and logging. */
class ExpressionContextTest {

    private ExpressionContext ctx;
    private Symbol x;
    private Symbol y;

    @BeforeEach
    void setUp() {
        ctx = new ExpressionContext();
        x = ctx.symbol("x");
        y = ctx.symbol("y");
    }

    @Nested
    class Helpers {

        @Test
        void symbolsPreserveOrder() {
            assertThat(ctx.symbols("b", "a", "x")).containsExactly(ctx.symbol("b"), ctx.symbol("a"), x);
        }

        @Test
        void negSubAndDiv() {
            assertThat(ctx.neg(ctx.neg(x))).isSameAs(x);
            assertThat(ctx.sub(x, x)).isSameAs(ctx.integer(0));
            assertThat(ctx.div(x, x)).isSameAs(ctx.integer(1));
            assertThat(ctx.div(ctx.integer(6), ctx.integer(4))).isSameAs(ctx.rational(3, 2));
            assertThat(ctx.sub(ctx.add(x, y), y)).isSameAs(x);
        }

        @Test
        void divisionByZeroIsUndefined() {
            assertThatThrownBy(() -> ctx.div(x, ctx.integer(0))).isInstanceOf(UndefinedExpressionException.class);
        }

        @Test
        void compareIsConsistentWithIdentity() {
            assertThat(ctx.compare(ctx.add(x, y), ctx.add(y, x))).isZero();
            assertThat(ctx.compare(x, y)).isNegative();
            assertThat(ctx.compare(y, x)).isPositive();
        }
    }

    @Nested
    class Scoping {

        @Test
        void separateContextsDoNotShareNodes() {
            var other = new ExpressionContext();

            assertThat((Expression) other.symbol("x")).isNotSameAs(x);
            assertThat(ctx.owns(x)).isTrue();
            assertThat(other.owns(x)).isFalse();
            assertThatThrownBy(() -> other.add(other.symbol("y"), x)).isInstanceOf(ForeignExpressionException.class);
            assertThatThrownBy(() -> other.compare(x, x)).isInstanceOf(ForeignExpressionException.class);
        }

        @Test
        void clearMakesOldExpressionsForeign() {
            Expression before = ctx.add(x, y);

            ctx.clear();

            assertThat(ctx.owns(before)).isFalse();
            assertThat((Expression) ctx.symbol("x")).isNotSameAs(x);
            assertThatThrownBy(() -> ctx.mul(before, ctx.symbol("z"))).isInstanceOf(ForeignExpressionException.class);
            assertThat(ctx.add(ctx.symbol("x"), ctx.symbol("y"))).isSameAs(ctx.add(ctx.symbol("y"), ctx.symbol("x")));
        }

        @Test
        void clearResetsStats() {
            ctx.add(x, y, ctx.apply("f", x));
            int populated = ctx.stats().size();

            ctx.clear();

            assertThat(ctx.stats().size()).isLessThan(populated);
            assertThat(ctx.stats().hits()).isZero();
        }

        @Test
        void statsCountReuse() {
            InternStats before = ctx.stats();
            ctx.symbol("q");
            ctx.symbol("q");
            InternStats after = ctx.stats();

            assertThat(after.size()).isEqualTo(before.size() + 1);
            assertThat(after.hits()).isGreaterThan(before.hits());
        }
    }

    @Test
    void concurrentConstructionYieldsOneInstance() throws Exception {
        Symbol z = ctx.symbol("z");
        List<Expression> operands = List.of(x, ctx.mul(ctx.integer(2), y), ctx.pow(z, ctx.integer(3)), ctx.integer(5));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Expression>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                long seed = i;
                futures.add(pool.submit(() -> {
                    List<Expression> shuffled = new ArrayList<>(operands);
                    Collections.shuffle(shuffled, new Random(seed));
                    return ctx.add(shuffled);
                }));
            }

            Set<Expression> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
            for (Future<Expression> future : futures) {
                distinct.add(future.get(10, TimeUnit.SECONDS));
            }
            assertThat(distinct).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Nested
    class Options {

        @TempDir
        Path tempDir;

        @Test
        void defaultOptions() {
            assertThat(ctx.options()).isEqualTo(ContextOptions.DEFAULT);
        }

        @Test
        void fromOptionsFile() throws IOException {
            Path file = tempDir.resolve("usymbol.yaml");
            Files.writeString(file, """
                    context:
                      max-folded-exponent: 4
                    """);

            var limited = ExpressionContext.fromOptionsFile(file);

            assertThat(limited.options().maxFoldedExponent()).isEqualTo(4);
            assertThat(limited.pow(limited.integer(3), limited.integer(4))).isSameAs(limited.integer(81));
            assertThat(limited.pow(limited.integer(3), limited.integer(5)).children()).hasSize(2);
        }

        @Test
        void missingOptionsFileFails() {
            assertThatThrownBy(() -> ExpressionContext.fromOptionsFile(tempDir.resolve("absent.yaml")))
                    .isInstanceOf(OptionsLoadException.class);
        }
    }

    @Nested
    class Logging {

        private ListAppender<ILoggingEvent> appender;
        private Logger logger;

        @BeforeEach
        void attachAppender() {
            logger = (Logger) LoggerFactory.getLogger(ExpressionContext.class);
            appender = new ListAppender<>();
            appender.start();
            logger.addAppender(appender);
        }

        @AfterEach
        void detachAppender() {
            logger.detachAppender(appender);
        }

        @Test
        void logsCreationAndClear() {
            var logged = new ExpressionContext(ContextOptions.builder().initialCapacity(64).build());
            logged.symbol("a");
            logged.clear();

            assertThat(appender.list)
                    .extracting(ILoggingEvent::getLevel)
                    .containsOnly(Level.DEBUG);
            assertThat(appender.list)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .anyMatch(m -> m.startsWith("Expression context created"))
                    .anyMatch(m -> m.startsWith("Expression context cleared: dropped 3 nodes"));
        }
    }
}
