package com.chordanalyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ChordAnalyzer - key detection and Roman-numeral analysis service.
 */
@SpringBootApplication
public class ChordAnalyzerApplication {

	public static void main(String[] args) {
		SpringApplication.run(ChordAnalyzerApplication.class, args);
	}

}
