package com.immowatch.backend.dedup.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldDifference {
    private Object seloger;
    private Object leboncoin;
}
