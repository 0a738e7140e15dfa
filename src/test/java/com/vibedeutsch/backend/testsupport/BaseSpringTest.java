package com.vibedeutsch.backend.testsupport;

import org.springframework.test.context.ActiveProfiles;

/**
 * 給所有 Spring 測試共用的基底類別：強制使用 test profile（H2、排程關閉、seed 關閉）
 */
@ActiveProfiles("test")
public abstract class BaseSpringTest {
}
