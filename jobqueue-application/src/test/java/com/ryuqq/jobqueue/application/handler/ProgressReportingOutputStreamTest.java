package com.ryuqq.jobqueue.application.handler;

import com.ryuqq.jobqueue.core.model.JobId;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ProgressReportingOutputStream 테스트.
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
class ProgressReportingOutputStreamTest {

    private final JobId jobId = JobId.of("1001");
    private final List<Integer> reported = new ArrayList<>();
    private final ByteArrayOutputStream sink = new ByteArrayOutputStream();

    @Test
    void write_바이트를_그대로_전달() throws IOException {
        // given
        ProgressReportingOutputStream out = new ProgressReportingOutputStream(
            sink, (id, percent) -> reported.add(percent), jobId, 30, 90, 10);

        // when
        out.write("Step 1/3 : FROM alpine\nStep 2/3".getBytes(StandardCharsets.UTF_8));
        out.write('\n');

        // then
        assertThat(sink.toString(StandardCharsets.UTF_8)).isEqualTo("Step 1/3 : FROM alpine\nStep 2/3\n");
        assertThat(out.lineCount()).isEqualTo(2);
    }

    @Test
    void write_줄_수에_비례해_구간_진행률_보고() throws IOException {
        // given: 30~90 구간, 예상 10줄
        ProgressReportingOutputStream out = new ProgressReportingOutputStream(
            sink, (id, percent) -> reported.add(percent), jobId, 30, 90, 10);

        // when
        for (int i = 0; i < 5; i++) {
            out.write(("line " + i + "\n").getBytes(StandardCharsets.UTF_8));
        }

        // then: 줄당 6%
        assertThat(reported).containsExactly(36, 42, 48, 54, 60);
    }

    @Test
    void write_예상_줄_수_초과_시_max에서_멈춤() throws IOException {
        // given
        ProgressReportingOutputStream out = new ProgressReportingOutputStream(
            sink, (id, percent) -> reported.add(percent), jobId, 30, 90, 2);

        // when
        out.write("a\nb\nc\nd\n".getBytes(StandardCharsets.UTF_8));
        out.write("e\n".getBytes(StandardCharsets.UTF_8));

        // then
        assertThat(reported).containsExactly(90);
        assertThat(out.currentProgress()).isEqualTo(90);
    }

    @Test
    void write_바이트_단위_기록은_진행률이_바뀔_때만_보고() throws IOException {
        // given
        ProgressReportingOutputStream out = new ProgressReportingOutputStream(
            sink, (id, percent) -> reported.add(percent), jobId, 30, 90, 2);

        // when: 한 바이트씩 두 줄 기록
        for (byte b : "Step 1\nStep 2\n".getBytes(StandardCharsets.UTF_8)) {
            out.write(b);
        }

        // then
        assertThat(reported).containsExactly(60, 90);
        assertThat(sink.toString(StandardCharsets.UTF_8)).isEqualTo("Step 1\nStep 2\n");
    }

    @Test
    void write_줄바꿈_없는_기록은_보고하지_않음() throws IOException {
        // given
        ProgressReportingOutputStream out = new ProgressReportingOutputStream(
            sink, (id, percent) -> reported.add(percent), jobId, 30, 90, 10);

        // when
        out.write("partial output without newline".getBytes(StandardCharsets.UTF_8));

        // then
        assertThat(reported).isEmpty();
    }

    @Test
    void write_부분_배열_범위만_계산() throws IOException {
        // given
        ProgressReportingOutputStream out = new ProgressReportingOutputStream(
            sink, (id, percent) -> reported.add(percent), jobId, 0, 100, 4);
        byte[] buffer = "x\ny\nz\n".getBytes(StandardCharsets.UTF_8);

        // when
        out.write(buffer, 2, 2);

        // then
        assertThat(sink.toString(StandardCharsets.UTF_8)).isEqualTo("y\n");
        assertThat(reported).containsExactly(25);
    }

    @Test
    void write_예상_줄_수_0이면_진행률_미보고() throws IOException {
        // given
        ProgressReportingOutputStream out = new ProgressReportingOutputStream(
            sink, (id, percent) -> reported.add(percent), jobId, 30, 90, 0);

        // when
        out.write("a\nb\n".getBytes(StandardCharsets.UTF_8));

        // then
        assertThat(reported).isEmpty();
        assertThat(sink.size()).isEqualTo(4);
        assertThat(out.lineCount()).isEqualTo(2);
    }

    @Test
    void write_보고_대상은_생성자에_전달한_JobId() throws IOException {
        // given
        List<JobId> ids = new ArrayList<>();
        ProgressReportingOutputStream out = new ProgressReportingOutputStream(
            sink, (id, percent) -> ids.add(id), jobId, 30, 90, 1);

        // when
        out.write("done\n".getBytes(StandardCharsets.UTF_8));

        // then
        assertThat(ids).containsExactly(jobId);
    }

    @Test
    void constructor_잘못된_구간이면_예외() {
        assertThatThrownBy(() -> new ProgressReportingOutputStream(
            sink, (id, percent) -> { }, jobId, 90, 30, 10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("progress range");

        assertThatThrownBy(() -> new ProgressReportingOutputStream(
            sink, (id, percent) -> { }, jobId, 30, 90, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
