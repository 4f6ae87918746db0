package com.chordanalyzer.application.analysis.exception;

public class EmptyProgressionException extends RuntimeException {
    public EmptyProgressionException() {
        super("분석할 수 있는 코드가 없습니다. 먼저 올바른 코드 진행을 입력해주세요.");
    }
}
