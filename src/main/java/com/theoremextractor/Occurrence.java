package com.theoremextractor;

/**
 * One {@code \begin{env}...\end{env}} region found in the expanded text.
 *
 * @param environment environment name
 * @param offset index of {@code \begin} in the expanded text
 * @param region main matter or appendix
 * @param index position within its region, from 0
 * @param note optional head note ({@code \begin{thm}[note]}), or {@code null}
 */
public record Occurrence(String environment, int offset, Region region, int index, String note) {

    public enum Region {
        MAIN,
        APPENDIX
    }
}
