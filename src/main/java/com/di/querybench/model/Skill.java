package com.di.querybench.model;

import lombok.Value;

@Value
public class Skill {
    long            id;
    /** Unique, {@code SKILL_<SOURCE>_<TARGET>}. */
    String          code;
    TranslationType translationType;
    String          sourceLanguage;
    String          targetLanguage;
}
