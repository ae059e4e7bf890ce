package com.ryuqq.jobqueue.application.handler;

import com.ryuqq.jobqueue.core.handler.ProgressReporter;
import com.ryuqq.jobqueue.core.model.JobId;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * 빌드 로그 스트림을 진행률로 환산하는 OutputStream.
 *
 * <p>모든 바이트를 하위 스트림에 그대로 전달하고, 지금까지 받은 줄바꿈 수를 예상 줄 수에 대비하여
 * [baseProgress, maxProgress] 구간의 진행률로 환산해 보고합니다.</p>
 *
 * <p><strong>환산식:</strong></p>
 * <pre>
 * progress = min(maxProgress, baseProgress + lines * (maxProgress - baseProgress) / estimatedLines)
 * </pre>
 *
 * <p>환산 값이 마지막 보고 값과 다를 때만 보고합니다. 구간 시작값은 호출자가 이미 보고한 것으로 간주합니다.
 * estimatedLines가 0이면 진행률을 보고하지 않습니다 (pass-through).
 * 진행률은 UI 표시용 추정치이며 완료 판단에 사용하지 않습니다.</p>
 *
 * <p><strong>동시성:</strong> 단일 빌드 스트림 전용, thread-safe하지 않음</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public class ProgressReportingOutputStream extends FilterOutputStream {

    private final ProgressReporter progressReporter;
    private final JobId jobId;
    private final int baseProgress;
    private final int maxProgress;
    private final int estimatedLines;

    private long lineCount;
    private int lastReported;

    /**
     * 생성자.
     *
     * @param out 하위 로그 스트림
     * @param progressReporter 진행률 보고 경로
     * @param jobId 대상 Job ID
     * @param baseProgress 구간 시작 진행률
     * @param maxProgress 구간 끝 진행률 (상한)
     * @param estimatedLines 예상 줄 수 (0이면 진행률 미보고)
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    public ProgressReportingOutputStream(
        OutputStream out,
        ProgressReporter progressReporter,
        JobId jobId,
        int baseProgress,
        int maxProgress,
        int estimatedLines
    ) {
        super(out);
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        if (progressReporter == null) {
            throw new IllegalArgumentException("progressReporter cannot be null");
        }
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (baseProgress < 0 || maxProgress > 100 || baseProgress > maxProgress) {
            throw new IllegalArgumentException(
                "progress range must satisfy 0 <= base <= max <= 100 (current: " + baseProgress + ".." + maxProgress + ")"
            );
        }
        if (estimatedLines < 0) {
            throw new IllegalArgumentException("estimatedLines cannot be negative (current: " + estimatedLines + ")");
        }
        this.progressReporter = progressReporter;
        this.jobId = jobId;
        this.baseProgress = baseProgress;
        this.maxProgress = maxProgress;
        this.estimatedLines = estimatedLines;
        this.lastReported = baseProgress;
    }

    @Override
    public void write(int b) throws IOException {
        out.write(b);
        if (b == '\n') {
            lineCount++;
        }
        reportProgress();
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        out.write(b, off, len);
        for (int i = off; i < off + len; i++) {
            if (b[i] == '\n') {
                lineCount++;
            }
        }
        reportProgress();
    }

    /**
     * 지금까지 받은 줄 수.
     *
     * @return 줄바꿈 개수
     */
    public long lineCount() {
        return lineCount;
    }

    /**
     * 현재 줄 수 기준 진행률.
     *
     * @return [baseProgress, maxProgress] 구간의 진행률
     */
    public int currentProgress() {
        if (estimatedLines == 0) {
            return baseProgress;
        }
        long progress = baseProgress + lineCount * (maxProgress - baseProgress) / estimatedLines;
        return (int) Math.min(maxProgress, progress);
    }

    private void reportProgress() {
        if (estimatedLines == 0) {
            return;
        }
        int progress = currentProgress();
        if (progress != lastReported) {
            lastReported = progress;
            progressReporter.updateProgress(jobId, progress);
        }
    }
}
