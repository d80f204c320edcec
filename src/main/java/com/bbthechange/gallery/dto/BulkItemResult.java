package com.bbthechange.gallery.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkItemResult {
    private String id;
    private BulkOutcome outcome;
}
