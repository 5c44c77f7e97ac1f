package com.mikov.emailverifier.dtos;

import com.mikov.emailverifier.smtp.dns.MxRecord;

import java.util.List;

/**
 * @param records mail exchangers for the hostname, most preferred first; empty when none exist
 */
public record MxRecordData(List<MxRecord> records) {

    public MxRecordData {
        records = List.copyOf(records);
    }
}
