package com.musicinsights.sparkifywarehouse.application.etl;

/**
 * 파일(또는 레코드) 단위 적재 결과. {@link #plus}로 합산한다.
 *
 * @param rowsWritten      INSERT/UPDATE로 영향받은 행 수
 * @param playsInserted    새로 삽입한 songplays 행 수
 * @param duplicatePlays   자연키 중복으로 건너뛴 songplays 수
 * @param unresolvedPlays  곡/아티스트를 찾지 못한 재생 수
 * @param malformedSkipped 잘못된 레코드라 건너뛴 수
 */
public record FileIngestResult(
        long rowsWritten,
        long playsInserted,
        long duplicatePlays,
        long unresolvedPlays,
        long malformedSkipped
) {
    public static final FileIngestResult EMPTY = new FileIngestResult(0, 0, 0, 0, 0);

    public static FileIngestResult rows(long n) {
        return new FileIngestResult(n, 0, 0, 0, 0);
    }

    public static FileIngestResult malformed(long n) {
        return new FileIngestResult(0, 0, 0, 0, n);
    }

    /**
     * 재생 한 건의 결과.
     *
     * @param rowsWritten time/users 적재로 영향받은 행 수
     * @param inserted    songplays 삽입 여부
     * @param resolved    곡 조회 성공 여부
     */
    public static FileIngestResult play(long rowsWritten, boolean inserted, boolean resolved) {
        return new FileIngestResult(
                rowsWritten + (inserted ? 1 : 0),
                inserted ? 1 : 0,
                inserted ? 0 : 1,
                resolved ? 0 : 1,
                0
        );
    }

    public FileIngestResult plus(FileIngestResult o) {
        return new FileIngestResult(
                rowsWritten + o.rowsWritten,
                playsInserted + o.playsInserted,
                duplicatePlays + o.duplicatePlays,
                unresolvedPlays + o.unresolvedPlays,
                malformedSkipped + o.malformedSkipped
        );
    }
}
