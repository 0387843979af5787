package org.example.questionnaire.logic;

public enum Connective {
    AND, OR, NOT
}
