package com.example.dataaccess.core.sql;

/** How the text of a {@link DataSetQuery} is interpreted. */
public enum CommandType {
  /** Statement text, possibly several statements separated as the driver allows. */
  TEXT,
  /** Name of a stored procedure, called with one placeholder per parameter. */
  STORED_PROCEDURE
}
