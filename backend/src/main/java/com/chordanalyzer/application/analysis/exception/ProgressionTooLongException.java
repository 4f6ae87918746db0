package com.chordanalyzer.application.analysis.exception;

public class ProgressionTooLongException extends RuntimeException {
    public ProgressionTooLongException(int maxLength) {
        super(String.format("코드 진행은 최대 %d자까지 입력할 수 있습니다.", maxLength));
    }
}
