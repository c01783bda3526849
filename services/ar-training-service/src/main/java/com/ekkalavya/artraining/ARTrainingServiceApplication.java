package com.ekkalavya.artraining;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * AR Training Service Application
 *
 * Runs adaptive AR sports drills for both full venues and confined rooms.
 *
 * Key Features:
 * - Bounce validation against drill targets with vision/audio confidence fusion
 * - Precision, pace and streak scoring per sport and difficulty
 * - Room safety analysis with space-aware drill pattern recommendations
 * - Marker layouts that respect a safety margin from walls
 * - Pose safety monitoring with automatic pause on critical risk
 * - Reconciliation of web (MediaPipe) and native (Flutter/Unity) session reports
 */
@SpringBootApplication
@EnableTransactionManagement
public class ARTrainingServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ARTrainingServiceApplication.class, args);
    }
}
