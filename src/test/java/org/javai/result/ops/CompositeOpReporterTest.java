package org.javai.result.ops;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CompositeOpReporterTest {

    @Test
    void reportFailure_fansOutToAllReporters() {
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();

        OpReporter composite = OpReporter.composite(
                (operation, failure) -> first.add(operation),
                (operation, failure) -> second.add(operation));

        composite.reportFailure("Op", new IOException("x"));

        assertThat(first).containsExactly("Op");
        assertThat(second).containsExactly("Op");
    }

    @Test
    void throwingReporter_doesNotStopOthers() {
        List<Throwable> defects = new ArrayList<>();
        OpReporter broken = new OpReporter() {
            @Override
            public void reportFailure(String operation, Exception failure) {
                throw new IllegalStateException("reporter down");
            }

            @Override
            public void reportDefect(String operation, Throwable defect) {
                throw new IllegalStateException("reporter down");
            }
        };
        OpReporter collecting = new OpReporter() {
            @Override
            public void reportFailure(String operation, Exception failure) {
            }

            @Override
            public void reportDefect(String operation, Throwable defect) {
                defects.add(defect);
            }
        };

        CompositeOpReporter composite = CompositeOpReporter.of(broken, collecting);
        RuntimeException bug = new RuntimeException("bug");

        assertThatCode(() -> composite.reportFailure("Op", new IOException("x"))).doesNotThrowAnyException();
        composite.reportDefect("Op", bug);

        assertThat(defects).containsExactly(bug);
    }

    @Test
    void builder_skipsNullAndDisabledReporters() {
        CompositeOpReporter composite = CompositeOpReporter.builder()
                .add(OpReporter.noOp())
                .add(null)
                .addIf(false, OpReporter.noOp())
                .addAll(List.of(OpReporter.noOp(), OpReporter.noOp()))
                .build();

        assertThat(composite.size()).isEqualTo(3);
    }

    @Test
    void of_collection_copiesReporters() {
        List<OpReporter> reporters = new ArrayList<>(List.of(OpReporter.noOp()));
        CompositeOpReporter composite = CompositeOpReporter.of(reporters);

        reporters.add(OpReporter.noOp());

        assertThat(composite.size()).isEqualTo(1);
    }
}
