package com.example.scheduling.service;

public enum RosterOperation { ADD, REMOVE }
